package org.tcgstats.metalens_api.modules.meta_analytics.engine;

import org.tcgstats.metalens_api.modules.meta_analytics.model.TimePeriod;

/**
 * The current period and the period it is compared against.
 */
public record TimeWindows(TimePeriod current, TimePeriod previous) {}
