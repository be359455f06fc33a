package ru.datana.integration.dataparc.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

class TagRowTest {
	private static final LocalDateTime TIME = LocalDateTime.of(2024, 5, 1, 8, 30);

	@Test
	void fromDriverRecord() {
		var row = TagRow.from(Map.of("tagName", "T1", "timestamp", Timestamp.valueOf(TIME), "value",
				new BigDecimal("123.45"), "quality", (short) 192));

		assertThat(row.getTagName()).isEqualTo("T1");
		assertThat(row.getTimestamp()).isEqualTo(TIME);
		assertThat(row.getValue()).isEqualTo(123.45);
		assertThat(row.getQuality()).isEqualTo(192);
	}

	@Test
	void acceptsLocalDateTime() {
		var row = TagRow.from(Map.of("tagName", "T1", "timestamp", TIME, "value", 1, "quality", 0));

		assertThat(row.getTimestamp()).isEqualTo(TIME);
	}

	@Test
	void missingFieldIsRejected() {
		var record = new HashMap<String, Object>(Map.of("tagName", "T1", "timestamp", TIME, "value", 1.0));

		assertThatIllegalStateException().isThrownBy(() -> TagRow.from(record)).withMessageContaining("quality");
	}

	@Test
	void nullFieldIsRejected() {
		var record = new HashMap<String, Object>(Map.of("tagName", "T1", "timestamp", TIME, "quality", 192));
		record.put("value", null);

		assertThatIllegalStateException().isThrownBy(() -> TagRow.from(record)).withMessageContaining("value");
	}

	@Test
	void wrongTypeIsRejected() {
		var record = Map.<String, Object>of("tagName", "T1", "timestamp", "2024-05-01", "value", 1.0, "quality", 192);

		assertThatIllegalStateException().isThrownBy(() -> TagRow.from(record)).withMessageContaining("timestamp");
	}

	@Test
	void attachKeepsWallClock() {
		var row = TagRow.builder().tagName("T1").timestamp(TIME).value(2.0).quality(192).build();

		var measurement = row.attach(ZoneId.of("America/Chicago"));

		assertThat(measurement.getTimestamp().toLocalDateTime()).isEqualTo(TIME);
		assertThat(measurement.getTimestamp().getOffset()).isEqualTo(ZoneOffset.ofHours(-5));
		assertThat(measurement.getTimestamp().getZone()).isEqualTo(ZoneId.of("America/Chicago"));
	}

	@Test
	void attachIsIdempotent() {
		var zone = ZoneId.of("Europe/Moscow");
		var row = TagRow.builder().tagName("T1").timestamp(TIME).value(2.0).quality(192).build();

		var once = row.attach(zone);
		var twice = once.getTimestamp().withZoneSameLocal(zone);

		assertThat(twice).isEqualTo(once.getTimestamp());
	}

	@Test
	void attachInsideDaylightSavingGapKeepsWallClock() {
		var springForward = LocalDateTime.of(2024, 3, 10, 2, 30);
		var row = TagRow.builder().tagName("T1").timestamp(springForward).value(2.0).quality(192).build();

		var measurement = row.attach(ZoneId.of("America/Chicago"));

		assertThat(measurement.getTimestamp().toLocalDateTime()).isEqualTo(springForward);
		assertThat(measurement.getTimestamp().getOffset()).isEqualTo(ZoneOffset.ofHours(-6));
	}

	@Test
	void attachInsideDaylightSavingOverlapKeepsWallClock() {
		var fallBack = LocalDateTime.of(2024, 11, 3, 1, 30);
		var row = TagRow.builder().tagName("T1").timestamp(fallBack).value(2.0).quality(192).build();

		var measurement = row.attach(ZoneId.of("America/Chicago"));

		assertThat(measurement.getTimestamp().toLocalDateTime()).isEqualTo(fallBack);
		assertThat(measurement.getTimestamp().getOffset()).isEqualTo(ZoneOffset.ofHours(-5));
	}
}
