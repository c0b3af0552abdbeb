package com.stewel.mining.io;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Reads transactions from plain text: one transaction per line, items separated by
 * whitespace. Blank lines are skipped.
 * <pre>
 *   1 2 5
 *   2 4
 * </pre>
 * Each token is converted to an item by the item parser; a token the parser rejects fails
 * the whole read with the offending line number.
 */
public class TextTransactionReader<T> implements TransactionReader<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextTransactionReader.class);

    private static final Splitter ITEM_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final Function<String, T> itemParser;

    public TextTransactionReader(final Function<String, T> itemParser) {
        this.itemParser = Objects.requireNonNull(itemParser, "itemParser");
    }

    /**
     * A reader keeping every token as a string item.
     */
    public static TextTransactionReader<String> ofStrings() {
        return new TextTransactionReader<>(Function.identity());
    }

    /**
     * A reader parsing every token as an integer item.
     */
    public static TextTransactionReader<Integer> ofIntegers() {
        return new TextTransactionReader<>(Integer::valueOf);
    }

    @Override
    public List<List<T>> readTransactions(final Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            final List<List<T>> transactions = readTransactions(reader);
            LOGGER.info("Read {} transactions from {}", transactions.size(), path);
            return transactions;
        }
    }

    @Override
    public List<List<T>> readTransactions(final Reader reader) throws IOException {
        final BufferedReader lines = reader instanceof BufferedReader
                ? (BufferedReader) reader
                : new BufferedReader(reader);
        final ImmutableList.Builder<List<T>> transactions = ImmutableList.builder();
        int lineNumber = 0;
        String line;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            final List<String> tokens = ITEM_SPLITTER.splitToList(line);
            if (tokens.isEmpty()) {
                continue;
            }
            final ImmutableList.Builder<T> transaction = ImmutableList.builder();
            for (final String token : tokens) {
                transaction.add(parseItem(token, lineNumber));
            }
            transactions.add(transaction.build());
        }
        return transactions.build();
    }

    private T parseItem(final String token, final int lineNumber) throws IOException {
        final T item;
        try {
            item = itemParser.apply(token);
        } catch (RuntimeException e) {
            throw new IOException("line " + lineNumber + ": cannot parse item '" + token + "'", e);
        }
        if (item == null) {
            throw new IOException("line " + lineNumber + ": item parser returned null for '" + token + "'");
        }
        return item;
    }
}
