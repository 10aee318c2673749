package com.propertyintel.ingest.extract;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CsvDialectSnifferTest {

    @Test
    void consistentCandidateWins() {
        assertThat(CsvDialectSniffer.sniff("a;b;c\n1;2,5;3\n4;5;6\n")).isEqualTo(';');
        assertThat(CsvDialectSniffer.sniff("a|b\n1|2\n")).isEqualTo('|');
        assertThat(CsvDialectSniffer.sniff("a\tb\tc\n1\t2\t3\n")).isEqualTo('\t');
    }

    @Test
    void delimitersInsideQuotesAreIgnored() {
        assertThat(CsvDialectSniffer.sniff("name;note\n\"x\";\"a,b,c\"\n\"y\";\"d,e\"\n")).isEqualTo(';');
    }

    @Test
    void truncatedLastLineIsNotCounted() {
        assertThat(CsvDialectSniffer.sniff("a,b,c\n1,2,3\n4;5")).isEqualTo(',');
    }

    @Test
    void defaultsToComma() {
        assertThat(CsvDialectSniffer.sniff("")).isEqualTo(',');
        assertThat(CsvDialectSniffer.sniff("single column\nvalues\n")).isEqualTo(',');
    }
}
