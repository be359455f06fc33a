package ru.datana.integration.dataparc.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DataTag {
	String id;
	String description;
	String units;
}
