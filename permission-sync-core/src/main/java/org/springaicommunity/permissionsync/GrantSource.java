package org.springaicommunity.permissionsync;

import java.util.Locale;

/**
 * Where an effective permission came from.
 */
public enum GrantSource {

	DIRECT, GROUP;

	/**
	 * Returns the lowercase label written to output files ("direct" or "group").
	 * @return the label
	 */
	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}

}
