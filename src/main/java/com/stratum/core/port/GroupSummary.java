package com.stratum.core.port;

import java.io.Serializable;

/**
 * A single summary folded from a group of named fragments.
 */
public record GroupSummary(String summary) implements Serializable {}
