package aliasview.core.model;

import java.time.Duration;

/**
 * Result of an explicit cache refresh.
 *
 * @param aliasesCount number of aliases served after the refresh
 * @param statistics   statistics computed right after the refresh
 * @param refreshTime  time spent refreshing and computing statistics
 */
public record RefreshReport(int aliasesCount, AliasStatistics statistics, Duration refreshTime) {}
