package ru.datana.integration.dataparc.model;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Row shape returned by every historian read function.
 */
@Value
@Builder
public class TagRow {
	public static final String TAG_NAME = "tagName";
	public static final String TIMESTAMP = "timestamp";
	public static final String VALUE = "value";
	public static final String QUALITY = "quality";

	String tagName;
	LocalDateTime timestamp;
	double value;
	int quality;

	/**
	 * @throws IllegalStateException when a field is missing or has an unexpected type
	 */
	public static TagRow from(Map<String, Object> record) {
		return TagRow.builder()
				.tagName(field(record, TAG_NAME).toString())
				.timestamp(toLocalDateTime(field(record, TIMESTAMP)))
				.value(toNumber(field(record, VALUE), VALUE).doubleValue())
				.quality(toNumber(field(record, QUALITY), QUALITY).intValue())
				.build();
	}

	/**
	 * Labels the store's wall-clock time with the zone. The clock value is never
	 * shifted: a time inside a daylight-saving gap keeps the offset in force
	 * before the transition.
	 */
	public TagMeasurement attach(ZoneId zone) {
		return new TagMeasurement(value, label(timestamp, zone), quality);
	}

	private static ZonedDateTime label(LocalDateTime local, ZoneId zone) {
		var zoned = local.atZone(zone);
		if (zoned.toLocalDateTime().equals(local)) {
			return zoned;
		}
		var transition = zone.getRules().getTransition(local);
		return ZonedDateTime.of(local, transition.getOffsetBefore());
	}

	private static Object field(Map<String, Object> record, String name) {
		var value = record.get(name);
		if (value == null) {
			throw new IllegalStateException("Row field '%s' is missing".formatted(name));
		}
		return value;
	}

	private static LocalDateTime toLocalDateTime(Object value) {
		if (value instanceof LocalDateTime ldt) {
			return ldt;
		}
		if (value instanceof Timestamp ts) {
			return ts.toLocalDateTime();
		}
		throw new IllegalStateException(
				"Row field '%s' has unexpected type %s".formatted(TIMESTAMP, value.getClass().getName()));
	}

	private static Number toNumber(Object value, String name) {
		if (value instanceof Number number) {
			return number;
		}
		throw new IllegalStateException(
				"Row field '%s' has unexpected type %s".formatted(name, value.getClass().getName()));
	}
}
