package com.example.recordsapi.models;

import jakarta.validation.constraints.NotBlank;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;

/**
 * A single row of the {@code records} table. The id is assigned by the database on insert and
 * is {@code null} until then.
 */
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class Record {

    private static final DateTimeFormatter TIMESTAMP_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private Long id;

    @NonNull
    @NotBlank
    private String name;

    @NonNull
    @NotBlank
    private String message;

    // null when absent, never blank
    private String note;

    @NonNull
    private Instant createdAt;

    @NonNull
    private Instant updatedAt;

    // ----- Domain helpers -----

    /**
     * Applies a partial update in place. A {@code null} name or message keeps the current value,
     * a provided note replaces the current one (clearing it when {@code null}), and updatedAt
     * always moves to {@code now}, never earlier than createdAt.
     */
    public Record applyPartialUpdate(String newName, String newMessage, boolean noteProvided,
                                     String newNote, Instant now) {
        Objects.requireNonNull(now, "now");
        if (newName != null) {
            this.name = newName;
        }
        if (newMessage != null) {
            this.message = newMessage;
        }
        if (noteProvided) {
            this.note = newNote;
        }
        this.updatedAt = now.isBefore(createdAt) ? createdAt : now;
        return this;
    }

    /**
     * Current instant truncated to the precision the database keeps, so that values handed back
     * to clients match what is stored.
     */
    public static Instant currentTimestamp(Clock clock) {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    public static String formatTimestamp(Instant instant) {
        return instant == null ? null : TIMESTAMP_FORMATTER.format(instant);
    }
}
