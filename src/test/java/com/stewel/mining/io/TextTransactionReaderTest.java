package com.stewel.mining.io;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TextTransactionReaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void readsOneTransactionPerLine() throws IOException {
        final List<List<Integer>> transactions =
                TextTransactionReader.ofIntegers().readTransactions(new StringReader("1 2 5\n\n2  4\n\t3\t1 \n"));
        assertEquals(Arrays.asList(
                Arrays.asList(1, 2, 5),
                Arrays.asList(2, 4),
                Arrays.asList(3, 1)), transactions);
    }

    @Test
    public void keepsDuplicateTokens() throws IOException {
        final List<List<String>> transactions =
                TextTransactionReader.ofStrings().readTransactions(new StringReader("milk bread milk"));
        assertEquals(Arrays.asList(Arrays.asList("milk", "bread", "milk")), transactions);
    }

    @Test
    public void reportsTheLineOfAnUnparsableItem() {
        try {
            TextTransactionReader.ofIntegers().readTransactions(new StringReader("1 2\n\n3 x\n"));
            fail("expected an IOException");
        } catch (IOException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("line 3:"));
            assertTrue(e.getCause() instanceof NumberFormatException);
        }
    }

    @Test
    public void readsFromAFile() throws IOException {
        final File file = folder.newFile("transactions.txt");
        Files.write(file.toPath(), "a b\nb c\n".getBytes(StandardCharsets.UTF_8));

        final List<List<String>> transactions = TextTransactionReader.ofStrings().readTransactions(file.toPath());
        assertEquals(Arrays.asList(Arrays.asList("a", "b"), Arrays.asList("b", "c")), transactions);
    }

    @Test
    public void emptyInputHasNoTransactions() throws IOException {
        assertTrue(TextTransactionReader.ofStrings().readTransactions(new StringReader("")).isEmpty());
    }
}
