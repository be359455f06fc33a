package ru.datana.integration.dataparc.util;

public interface LogConsts {
	static final String IN_0 = "==>";
	static final String IN_1 = "==> [{}]";
	static final String IN_2 = "==> [{}] {}";
	static final String IN_3 = "==> [{}] {} {}";
	static final String OUT_1 = "<== {}";
}
