package io.b2mash.taskboard.dashboard;

import io.b2mash.taskboard.dashboard.dto.BoardOverview;
import io.b2mash.taskboard.dashboard.dto.TaskSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Aggregated, read-only views over all tasks. */
@RestController
public class DashboardController {

  private final SummaryService summaryService;

  public DashboardController(SummaryService summaryService) {
    this.summaryService = summaryService;
  }

  /** Returns task counts by status, the urgent count and the completion percentage. */
  @GetMapping("/api/summary")
  public ResponseEntity<TaskSummary> getSummary() {
    return ResponseEntity.ok(summaryService.getTaskSummary());
  }

  @GetMapping("/api/board")
  public ResponseEntity<BoardOverview> getBoard() {
    return ResponseEntity.ok(summaryService.getBoardOverview());
  }
}
