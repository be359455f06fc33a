package ru.datana.integration.dataparc.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Historian quality code classification. Only exact codes are recognised.
 */
@Getter
@RequiredArgsConstructor
public enum Quality {
	GOOD("Good"),
	BAD("Bad"),
	UNKNOWN("Unknown");

	public static final int GOOD_CODE = 192;
	public static final int BAD_CODE = 0;

	private final String label;

	public static Quality of(int code) {
		if (code == GOOD_CODE) {
			return GOOD;
		}
		return code == BAD_CODE ? BAD : UNKNOWN;
	}
}
