package com.hwapi.core.parser.impl.bugcheck;

import com.hwapi.core.model.BugcheckCode;
import com.hwapi.core.parser.DatabaseParseException;
import com.hwapi.core.parser.text.TextCursor;
import com.hwapi.core.parser.text.TextParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BugcheckTableParser}.
 */
class BugcheckTableParserTest {

    private final BugcheckTableParser parser = new BugcheckTableParser();

    @Test
    void readRow_unescapesNameAndResolvesLink() throws TextParseException {
        TextCursor cursor = new TextCursor(
            "| 0x00000001 | [**APC\\_INDEX\\_MISMATCH**](bug-check-0x1--apc-index-mismatch.md)         |\n");

        BugcheckCode code = parser.readRow(cursor);

        assertThat(code).isEqualTo(new BugcheckCode(1, "APC_INDEX_MISMATCH",
            "https://learn.microsoft.com/en-us/windows-hardware/drivers/debugger/bug-check-0x1--apc-index-mismatch"));
        assertThat(cursor.atEnd()).isTrue();
    }

    @Test
    void readRow_lastRowWithoutNewline_isAccepted() throws TextParseException {
        TextCursor cursor = new TextCursor("| 0xDEADDEAD | [**MANUALLY\\_INITIATED\\_CRASH1**](bug-check-0xdeaddead.md) |");

        assertThat(parser.readRow(cursor).code()).isEqualTo(0xDEADDEADL);
    }

    @Test
    void parse_readsRowsUntilTableEnds() {
        List<BugcheckCode> codes = parser.parse("""
            # Bug Check Code Reference

            | Code | Name |
            |------|------|
            | 0x00000001 | [**APC\\_INDEX\\_MISMATCH**](bug-check-0x1--apc-index-mismatch.md) |
            | 0x0000000A | [**IRQL\\_NOT\\_LESS\\_OR\\_EQUAL**](bug-check-0xa--irql-not-less-or-equal.md) |
            | 0xC000021A | [**STATUS\\_SYSTEM\\_PROCESS\\_TERMINATED**](bug-check-0xc000021a.md) |

            ## See also
            | 0x00000002 | [**NOT\\_READ**](x.md) |
            """);

        assertThat(codes).extracting(BugcheckCode::code).containsExactly(0x1L, 0xAL, 0xC000021AL);
        assertThat(codes.get(1).name()).isEqualTo("IRQL_NOT_LESS_OR_EQUAL");
    }

    @Test
    void parse_customBaseUrl_isUsedForLinks() {
        BugcheckTableParser custom = new BugcheckTableParser("https://docs.example.org/debugger");

        List<BugcheckCode> codes = custom.parse("| 0x00000001 | [**APC\\_INDEX\\_MISMATCH**](apc.md) |\n");

        assertThat(codes.get(0).url()).isEqualTo("https://docs.example.org/debugger/apc");
    }

    @Test
    void parse_nonHexCode_fails() {
        assertThatThrownBy(() -> parser.parse("""
            | 0x00000001 | [**A**](a.md) |
            | 0x0000000G | [**B**](b.md) |
            """))
            .isInstanceOf(DatabaseParseException.class)
            .satisfies(e -> assertThat(((DatabaseParseException) e).line()).isEqualTo(2));
    }

    @Test
    void parse_fullwidthDigitsInCode_fails() {
        assertThatThrownBy(() -> parser.parse("""
            | 0x00000001 | [**A**](a.md) |
            | 0x0000013\uFF13 | [**B**](b.md) |
            """))
            .isInstanceOf(DatabaseParseException.class)
            .hasMessageContaining("not a hex literal");
    }

    @Test
    void parse_noTable_fails() {
        assertThatThrownBy(() -> parser.parse("# nothing here\n"))
            .isInstanceOf(DatabaseParseException.class);
    }
}
