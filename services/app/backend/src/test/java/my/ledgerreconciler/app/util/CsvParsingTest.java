package my.ledgerreconciler.app.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class CsvParsingTest {
	@Test
	void sniffDelimiterLooksAtHeaderOnly() {
		assertThat(CsvParsing.sniffDelimiter("Client;Suma\n\"A, B\";\"1,5\"\n")).isEqualTo(';');
		assertThat(CsvParsing.sniffDelimiter("Client,Suma\nA;B,1\n")).isEqualTo(',');
		assertThat(CsvParsing.sniffDelimiter("")).isEqualTo(',');
	}

	@Test
	void decodeUtf8StripsByteOrderMark() {
		byte[] payload = "\uFEFFClient,Suma".getBytes(StandardCharsets.UTF_8);

		assertThat(CsvParsing.decodeUtf8(payload)).isEqualTo("Client,Suma");
	}

	@Test
	void parseDecimalToleratesBlanksAndRejectsGarbage() {
		assertThat(CsvParsing.parseDecimal(" 1 234.50 ")).isEqualByComparingTo(new BigDecimal("1234.50"));
		assertThat(CsvParsing.parseDecimal("-12")).isEqualByComparingTo(new BigDecimal("-12"));
		assertThat(CsvParsing.parseDecimal("")).isNull();
		assertThat(CsvParsing.parseDecimal(null)).isNull();
		assertThat(CsvParsing.parseDecimal("n/a")).isNull();
	}
}
