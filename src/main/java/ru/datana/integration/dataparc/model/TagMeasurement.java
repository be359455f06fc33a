package ru.datana.integration.dataparc.model;

import static com.google.common.base.Preconditions.checkNotNull;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

/**
 * One observation of one tag. The timestamp always carries the connector's
 * zone.
 */
@Value
@JsonPropertyOrder({ "value", "timestamp", "quality", "qualityLabel" })
public class TagMeasurement {
	private static final DateTimeFormatter TEXT_FORMAT = DateTimeFormatter.ofPattern("MM/dd/yy HH:mm:ss Z",
			Locale.ROOT);

	@Schema(description = "Measured value", example = "123.45")
	double value;
	@Schema(description = "Sample time in the historian's zone", example = "2024-05-01T08:30:00.000+09:00")
	@JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSSXXX")
	ZonedDateTime timestamp;
	@Schema(description = "Historian quality code", example = "192")
	int quality;

	public TagMeasurement(double value, ZonedDateTime timestamp, int quality) {
		this.value = value;
		this.timestamp = checkNotNull(timestamp, "timestamp");
		this.quality = quality;
	}

	@JsonProperty("qualityLabel")
	@Schema(description = "Good, Bad or Unknown", example = "Good")
	public String qualityStr() {
		return Quality.of(quality).getLabel();
	}

	@Override
	public String toString() {
		return String.format(Locale.ROOT, "%.2f at %s (S:%s)", value, TEXT_FORMAT.format(timestamp), qualityStr());
	}
}
