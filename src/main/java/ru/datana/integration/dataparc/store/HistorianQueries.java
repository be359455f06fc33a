package ru.datana.integration.dataparc.store;

/**
 * Statement templates for the DataParc table-valued read functions. The trailing
 * {@code ','} argument is the delimiter the functions use to split multi-value
 * string arguments.
 */
public interface HistorianQueries {
	String DELIMITER = ",";

	String CHECK = "SELECT 1";

	String READ_LAST_TAGS = "SELECT tagName, timestamp, value, quality "
			+ "FROM ctc_fn_PARCdata_ReadLastTags (?, ',')";

	// 1 selects raw mode
	String READ_RAW_TAGS = "SELECT tagName, timestamp, value, quality "
			+ "FROM ctc_fn_PARCdata_ReadRawTags (?, ?, ?, 1, ',')";

	String READ_INTERPOLATED_TAGS = "SELECT tagName, timestamp, value, quality "
			+ "FROM ctc_fn_PARCdata_ReadInterpolatedTags (?, ?, ?, ?, ?, ',')";

	String READ_AT_TIME_TAGS = "SELECT tagName, timestamp, value, quality "
			+ "FROM ctc_fn_PARCdata_ReadAtTimeTags (?, ?, ',')";
}
