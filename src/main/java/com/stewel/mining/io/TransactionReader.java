package com.stewel.mining.io;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction for loading a transaction database.
 * <p>
 * Implementations parse the physical format and produce the transactions in the order
 * they appear in the source, ready to be passed to the miner.
 *
 * @param <T> the item type
 */
public interface TransactionReader<T> {

    /**
     * Reads all transactions from a file.
     *
     * @param path the file
     * @return the transactions in source order; never {@code null}
     * @throws IOException if the file cannot be read or is malformed
     */
    List<List<T>> readTransactions(Path path) throws IOException;

    /**
     * Reads all transactions from a character stream. The reader is not closed.
     */
    List<List<T>> readTransactions(Reader reader) throws IOException;
}
