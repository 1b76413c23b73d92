package com.hwapi.core.parser.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TextCursor} and {@link TextSlice}.
 */
class TextCursorTest {

    @Test
    void tag_matchingLiteral_advancesCursor() throws TextParseException {
        TextCursor cursor = new TextCursor("PCI\\VEN_10EC");

        cursor.tag("PCI\\VEN_");

        assertThat(cursor.position()).isEqualTo(8);
        assertThat(cursor.rest()).isEqualTo("10EC");
    }

    @Test
    void tag_mismatch_reportsLiteralAndLeavesCursor() {
        TextCursor cursor = new TextCursor("USB\\VID_1234");

        assertThatThrownBy(() -> cursor.tag("PCI\\VEN_"))
            .isInstanceOf(TextParseException.class)
            .satisfies(e -> {
                TextParseException failure = (TextParseException) e;
                assertThat(failure.expected()).contains("VEN_");
                assertThat(failure.offset()).isZero();
            });
        assertThat(cursor.position()).isZero();
    }

    @Test
    void takeHex_parsesMixedCase() throws TextParseException {
        TextCursor cursor = new TextCursor("10eC&");

        assertThat(cursor.takeHex(4)).isEqualTo(0x10EC);
        assertThat(cursor.rest()).isEqualTo("&");
    }

    @Test
    void takeHex_nonHexDigit_failsWithoutConsuming() {
        TextCursor cursor = new TextCursor("10G1");

        assertThatThrownBy(() -> cursor.takeHex(4))
            .isInstanceOf(TextParseException.class)
            .hasMessageContaining("4 hex digits");
        assertThat(cursor.position()).isZero();
    }

    @Test
    void takeHex_tooShort_fails() {
        TextCursor cursor = new TextCursor("10E");

        assertThatThrownBy(() -> cursor.takeHex(4)).isInstanceOf(TextParseException.class);
    }

    @Test
    void takeHex_fullwidthAndNonLatinDigits_areRejected() {
        TextCursor fullwidth = new TextCursor("\uFF11\uFF10\uFF25\uFF23");
        TextCursor arabicIndic = new TextCursor("\u0661\u0662\u0663\u0664");

        assertThatThrownBy(() -> fullwidth.takeHex(4)).isInstanceOf(TextParseException.class);
        assertThatThrownBy(() -> arabicIndic.takeHex(4)).isInstanceOf(TextParseException.class);
        assertThat(fullwidth.position()).isZero();
    }

    @Test
    void isHexDigit_acceptsOnlyAsciiHex() {
        for (char c : "0123456789abcdefABCDEF".toCharArray()) {
            assertThat(TextCursor.isHexDigit(c)).as("'%s'", c).isTrue();
        }
        assertThat(TextCursor.isHexDigit('g')).isFalse();
        assertThat(TextCursor.isHexDigit('\uFF21')).isFalse();
        assertThat(TextCursor.isHexDigit('\u0661')).isFalse();
    }

    @Test
    void lookingAtHex_doesNotConsume() {
        TextCursor cursor = new TextCursor("10ec  Realtek");

        assertThat(cursor.lookingAtHex(4)).isTrue();
        assertThat(cursor.lookingAtHex(5)).isFalse();
        assertThat(cursor.position()).isZero();
        assertThat(new TextCursor("C 00").lookingAtHex(4)).isFalse();
        assertThat(new TextCursor("10").lookingAtHex(4)).isFalse();
    }

    @Test
    void takeUntil_stopsBeforeTerminator() throws TextParseException {
        TextCursor cursor = new TextCursor("name**]rest");

        assertThat(cursor.takeUntil("**]")).isEqualTo("name");
        assertThat(cursor.rest()).isEqualTo("**]rest");
    }

    @Test
    void delimited_missingClose_restoresPosition() {
        TextCursor cursor = new TextCursor("[**name]");

        assertThatThrownBy(() -> cursor.delimited("[**", "**]")).isInstanceOf(TextParseException.class);
        assertThat(cursor.position()).isZero();
    }

    @Test
    void takeLine_lastLineWithoutNewline_isReturned() {
        TextCursor cursor = new TextCursor("first\nsecond");

        assertThat(cursor.takeLine()).isEqualTo("first");
        assertThat(cursor.takeLine()).isEqualTo("second");
        assertThat(cursor.atEnd()).isTrue();
    }

    @Test
    void skipToLineStartingWith_ignoresMatchesInsideLines() throws TextParseException {
        TextCursor cursor = new TextCursor("# 0001 in a comment\n\t\t8086 0001  x\n0001  SafeNet\n");

        cursor.skipToLineStartingWith("0001 ");

        assertThat(cursor.rest()).startsWith("0001  SafeNet");
        assertThat(cursor.lineNumber()).isEqualTo(3);
    }

    @Test
    void slice_splitAndStrip_keepEmptyCells() {
        TextSlice row = TextSlice.of("label ,a , ,b ");

        List<String> cells = row.split(",").stream().map(cell -> cell.strip().toString()).toList();

        assertThat(cells).containsExactly("label", "a", "", "b");
    }

    @Test
    void slice_equalsAndHashCode_followContent() {
        TextSlice fromLine = TextSlice.of("xx Cores yy", 3, 8);
        TextSlice whole = TextSlice.of("Cores");

        assertThat((CharSequence) fromLine).isEqualTo(whole);
        assertThat(fromLine.hashCode()).isEqualTo("Cores".hashCode());
        assertThat(fromLine.toString()).isEqualTo("Cores");
    }
}
