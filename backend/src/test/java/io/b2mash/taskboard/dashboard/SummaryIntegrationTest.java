package io.b2mash.taskboard.dashboard;

import static io.b2mash.taskboard.testutil.TestTaskboardFactory.createContact;
import static io.b2mash.taskboard.testutil.TestTaskboardFactory.createTask;
import static io.b2mash.taskboard.testutil.TestTaskboardFactory.userJwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.taskboard.TestcontainersConfiguration;
import io.b2mash.taskboard.task.SubtaskRepository;
import io.b2mash.taskboard.task.TaskAssignmentRepository;
import io.b2mash.taskboard.task.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SummaryIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private TaskRepository taskRepository;
  @Autowired private SubtaskRepository subtaskRepository;
  @Autowired private TaskAssignmentRepository taskAssignmentRepository;

  @BeforeEach
  void clearTasks() {
    subtaskRepository.deleteAll();
    taskAssignmentRepository.deleteAll();
    taskRepository.deleteAll();
  }

  @Test
  void emptyCollectionYieldsZeroes() throws Exception {
    mockMvc
        .perform(get("/api/summary").with(userJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$['total-tasks']").value(0))
        .andExpect(jsonPath("$['completed-percentage']").value(0.0));
  }

  @Test
  void countsStatusesUrgentAndCompletedPercentage() throws Exception {
    task("A", "to-do", "low");
    task("B", "to-do", "medium");
    task("C", "in-progress", "urgent");
    task("D", "done", "low");

    mockMvc
        .perform(get("/api/summary").with(userJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$['to-do']").value(2))
        .andExpect(jsonPath("$['in-progress']").value(1))
        .andExpect(jsonPath("$['await-feedback']").value(0))
        .andExpect(jsonPath("$.done").value(1))
        .andExpect(jsonPath("$['total-tasks']").value(4))
        .andExpect(jsonPath("$.urgent").value(1))
        .andExpect(jsonPath("$['completed-percentage']").value(25.0));
  }

  @Test
  void urgentTaskWithTwoContactsIsCounted() throws Exception {
    var first = createContact(mockMvc, "Summary One");
    var second = createContact(mockMvc, "Summary Two");
    createTask(
        mockMvc,
        """
        {"title": "T1", "due_date": "2025-01-01", "priority": "urgent", "contact_ids": [%d, %d]}
        """
            .formatted(first, second));

    mockMvc
        .perform(get("/api/summary").with(userJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.urgent").value(1))
        .andExpect(jsonPath("$['total-tasks']").value(1));
  }

  @Test
  void boardOverviewListsFlatTaskRows() throws Exception {
    task("Row", "await-feedback", "medium");

    mockMvc
        .perform(get("/api/board").with(userJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.board.length()").value(1))
        .andExpect(jsonPath("$.board[0].title").value("Row"))
        .andExpect(jsonPath("$.board[0].status").value("await-feedback"))
        .andExpect(jsonPath("$.board[0].subtasks").doesNotExist());
  }

  private void task(String title, String status, String priority) throws Exception {
    createTask(
        mockMvc,
        """
        {"title": "%s", "due_date": "2025-01-01", "priority": "%s", "status": "%s"}
        """
            .formatted(title, priority, status));
  }
}
