package com.example.recordsapi.access;

import com.example.recordsapi.models.Record;
import java.util.List;
import java.util.Optional;

public interface RecordAccess {

    /**
     * Returns every stored record ordered by id ascending.
     */
    List<Record> findAll();

    Optional<Record> findById(long id);

    /**
     * Inserts a new row. The id of the given record is ignored; the returned record carries the
     * id generated by the store.
     *
     * @param record the record to insert, without an id
     * @return the stored record including its generated id
     */
    Record insert(Record record);

    /**
     * Writes name, message, note and updatedAt for the row with {@code record.getId()}.
     * createdAt is never overwritten.
     *
     * @param record the record carrying the new field values
     * @return the stored record, or empty when no row has that id
     */
    Optional<Record> update(Record record);

    /**
     * @return true when a row was removed
     */
    boolean delete(long id);
}
