package com.mk.fx.qa.loadster.metrics;

import com.mk.fx.qa.loadster.cfg.LoadsterCfg;
import com.mk.fx.qa.loadster.dto.LoadTestRunReport;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.springframework.stereotype.Component;

/**
 * Thread-safe registry of finished run reports. Keeps the most recent {@code loadster.history-size}
 * reports and evicts older ones.
 */
@Component
public class LoadReportRegistry {

  private final int historySize;
  private final Map<UUID, LoadTestRunReport> reports = new ConcurrentHashMap<>();
  private final Deque<UUID> order = new ConcurrentLinkedDeque<>();

  public LoadReportRegistry(LoadsterCfg cfg) {
    this.historySize = Math.max(1, cfg.getHistorySize());
  }

  /** Saves the report of a finished run, evicting the oldest reports beyond the history size. */
  public synchronized void save(LoadTestRunReport report) {
    if (reports.put(report.runId, report) == null) {
      order.addFirst(report.runId);
    }
    while (order.size() > historySize) {
      var evicted = order.pollLast();
      if (evicted != null) {
        reports.remove(evicted);
      }
    }
  }

  /** Retrieves a previously saved run report, if still retained. */
  public Optional<LoadTestRunReport> getReport(UUID runId) {
    return Optional.ofNullable(reports.get(runId));
  }

  /** Retained reports, most recent first. */
  public List<LoadTestRunReport> history() {
    List<LoadTestRunReport> list = new ArrayList<>();
    for (UUID id : order) {
      var report = reports.get(id);
      if (report != null) list.add(report);
    }
    return List.copyOf(list);
  }
}
