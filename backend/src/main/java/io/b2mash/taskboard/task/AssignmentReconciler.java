package io.b2mash.taskboard.task;

import io.b2mash.taskboard.contact.Contact;
import io.b2mash.taskboard.contact.ContactRepository;
import io.b2mash.taskboard.exception.FieldValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converges a task's persisted contact assignments and subtask list to a requested target state.
 * Callers own the transaction; every check runs before the first write.
 */
@Component
public class AssignmentReconciler {

  private static final Logger log = LoggerFactory.getLogger(AssignmentReconciler.class);

  static final String CONTACT_IDS_FIELD = "contact_ids";
  static final String SUBTASKS_FIELD = "subtasks";

  private final TaskAssignmentRepository taskAssignmentRepository;
  private final SubtaskRepository subtaskRepository;
  private final ContactRepository contactRepository;

  public AssignmentReconciler(
      TaskAssignmentRepository taskAssignmentRepository,
      SubtaskRepository subtaskRepository,
      ContactRepository contactRepository) {
    this.taskAssignmentRepository = taskAssignmentRepository;
    this.subtaskRepository = subtaskRepository;
    this.contactRepository = contactRepository;
  }

  /**
   * Makes the task's assignment set equal to {@code requestedIds}. An empty collection clears all
   * assignments. Unchanged assignment rows are kept.
   *
   * @return the assigned contact ids after reconciliation, ascending
   * @throws FieldValidationException if any id does not name an existing contact
   */
  public Set<Long> reconcileContacts(Long taskId, Collection<Long> requestedIds) {
    Set<Long> requested = new TreeSet<>(requestedIds);
    requireExistingContacts(requested);

    Set<Long> kept = new HashSet<>();
    int removed = 0;
    for (TaskAssignment assignment : taskAssignmentRepository.findByTaskId(taskId)) {
      if (requested.contains(assignment.getContactId())) {
        kept.add(assignment.getContactId());
      } else {
        taskAssignmentRepository.delete(assignment);
        removed++;
      }
    }

    int added = 0;
    for (Long contactId : requested) {
      if (!kept.contains(contactId)) {
        taskAssignmentRepository.save(new TaskAssignment(taskId, contactId));
        added++;
      }
    }

    log.debug(
        "Reconciled contacts of task {}: {} added, {} removed, {} kept",
        taskId,
        added,
        removed,
        kept.size());
    return requested;
  }

  /**
   * Replaces the task's subtask list with {@code descriptors}, in input order. A {@code null} or
   * empty list leaves the existing subtasks untouched. Descriptors carrying the id of one of the
   * task's subtasks update it in place; all other existing subtasks are deleted.
   *
   * @return the task's subtasks after reconciliation, in order
   * @throws FieldValidationException if a descriptor id is foreign to the task or repeated
   */
  public List<Subtask> reconcileSubtasks(Long taskId, List<SubtaskDescriptor> descriptors) {
    var existing = subtaskRepository.findByTaskIdOrderBySortOrderAscIdAsc(taskId);
    if (descriptors == null || descriptors.isEmpty()) {
      return existing;
    }

    Map<Long, Subtask> existingById =
        existing.stream().collect(Collectors.toMap(Subtask::getId, Function.identity()));
    requireOwnedDistinctIds(taskId, descriptors, existingById.keySet());

    Set<Long> referenced =
        descriptors.stream()
            .map(SubtaskDescriptor::id)
            .filter(id -> id != null)
            .collect(Collectors.toSet());
    var obsolete = existing.stream().filter(s -> !referenced.contains(s.getId())).toList();
    subtaskRepository.deleteAll(obsolete);

    List<Subtask> result = new ArrayList<>(descriptors.size());
    for (int i = 0; i < descriptors.size(); i++) {
      var descriptor = descriptors.get(i);
      Subtask subtask;
      if (descriptor.id() != null) {
        subtask = existingById.get(descriptor.id());
        subtask.update(descriptor.title(), descriptor.completedOrDefault(), i);
      } else {
        subtask = new Subtask(taskId, descriptor.title(), descriptor.completedOrDefault(), i);
      }
      result.add(subtask);
    }
    result = subtaskRepository.saveAll(result);

    log.debug(
        "Reconciled subtasks of task {}: {} now, {} deleted",
        taskId,
        result.size(),
        obsolete.size());
    return result;
  }

  private void requireExistingContacts(Set<Long> contactIds) {
    if (contactIds.isEmpty()) {
      return;
    }
    Set<Long> found =
        contactRepository.findAllById(contactIds).stream()
            .map(Contact::getId)
            .collect(Collectors.toSet());
    var unknown = contactIds.stream().filter(id -> !found.contains(id)).toList();
    if (!unknown.isEmpty()) {
      String ids = unknown.stream().map(String::valueOf).collect(Collectors.joining(", "));
      throw new FieldValidationException(CONTACT_IDS_FIELD, "Unknown contact id(s): " + ids);
    }
  }

  private static void requireOwnedDistinctIds(
      Long taskId, List<SubtaskDescriptor> descriptors, Set<Long> ownedIds) {
    Map<String, List<String>> errors = new LinkedHashMap<>();
    Set<Long> seen = new HashSet<>();
    for (int i = 0; i < descriptors.size(); i++) {
      Long id = descriptors.get(i).id();
      if (id == null) {
        continue;
      }
      String field = SUBTASKS_FIELD + "[" + i + "].id";
      if (!ownedIds.contains(id)) {
        errors.put(field, List.of("Subtask " + id + " does not belong to task " + taskId));
      } else if (!seen.add(id)) {
        errors.put(field, List.of("Subtask " + id + " is listed more than once"));
      }
    }
    if (!errors.isEmpty()) {
      throw new FieldValidationException(errors);
    }
  }
}
