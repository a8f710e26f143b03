package com.example.h3csv.csv;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecordTextReaderTest {

    private static List<String> records(String text, char delimiter) throws IOException {
        List<String> out = new ArrayList<>();
        try (RecordTextReader reader = new RecordTextReader(new StringReader(text), delimiter, '"')) {
            String record;
            while ((record = reader.next()) != null) {
                out.add(record);
            }
        }
        return out;
    }

    @Test
    void splitsOnAnyLineEndingAndSkipsEmptyLines() throws IOException {
        assertThat(records("a,b\n\nc,d\r\ne,f\rg,h", ','))
                .containsExactly("a,b", "c,d", "e,f", "g,h");
    }

    @Test
    void keepsLineBreaksAndEscapedQuotesInsideQuotedFields() throws IOException {
        assertThat(records("\"x\ny\",1\n\"say \"\"hi\"\"\nnow\",2\n", ','))
                .containsExactly("\"x\ny\",1", "\"say \"\"hi\"\"\nnow\",2");
    }

    @Test
    void quoteInsideUnquotedFieldIsLiteral() throws IOException {
        assertThat(records("5\" pipe,1\nnext,2\n", ',')).containsExactly("5\" pipe,1", "next,2");
    }

    @Test
    void closedQuoteFollowedByJunkEndsAtLineBreak() throws IOException {
        assertThat(records("1,\"40.7\"x,-74\n3,4\n", ',')).containsExactly("1,\"40.7\"x,-74", "3,4");
    }

    @Test
    void quoteOpensFieldAfterCustomDelimiter() throws IOException {
        assertThat(records("a;\"b\nc\";d\n", ';')).containsExactly("a;\"b\nc\";d");
    }

    @Test
    void emptyInputHasNoRecords() throws IOException {
        assertThat(records("", ',')).isEmpty();
        assertThat(records("\n\r\n", ',')).isEmpty();
    }
}
