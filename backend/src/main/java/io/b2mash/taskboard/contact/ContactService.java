package io.b2mash.taskboard.contact;

import io.b2mash.taskboard.exception.FieldValidationException;
import io.b2mash.taskboard.exception.ResourceNotFoundException;
import io.b2mash.taskboard.task.TaskAssignmentRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ContactService {

  private static final Logger log = LoggerFactory.getLogger(ContactService.class);

  private final ContactRepository contactRepository;
  private final TaskAssignmentRepository taskAssignmentRepository;

  public ContactService(
      ContactRepository contactRepository, TaskAssignmentRepository taskAssignmentRepository) {
    this.contactRepository = contactRepository;
    this.taskAssignmentRepository = taskAssignmentRepository;
  }

  @Transactional(readOnly = true)
  public List<Contact> listContacts() {
    return contactRepository.findAllByOrderByNameAscIdAsc();
  }

  @Transactional(readOnly = true)
  public Contact getContact(Long id) {
    return contactRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Contact", id));
  }

  @Transactional
  public Contact createContact(String name, String email, String phone, String color) {
    if (contactRepository.existsByEmailIgnoreCase(email)) {
      throw duplicateEmail();
    }
    var contact = contactRepository.save(new Contact(name, email, phone, color));
    log.info("Created contact {}", contact.getId());
    return contact;
  }

  @Transactional
  public Contact updateContact(Long id, String name, String email, String phone, String color) {
    var contact = getContact(id);
    if (email != null && contactRepository.existsByEmailIgnoreCaseAndIdNot(email, id)) {
      throw duplicateEmail();
    }
    contact.update(name, email, phone, color);
    contact = contactRepository.save(contact);
    log.info("Updated contact {}", id);
    return contact;
  }

  /** Deletes the contact and its task assignments. The tasks themselves are kept. */
  @Transactional
  public void deleteContact(Long id) {
    var contact = getContact(id);
    taskAssignmentRepository.deleteByContactId(id);
    contactRepository.delete(contact);
    log.info("Deleted contact {}", id);
  }

  private static FieldValidationException duplicateEmail() {
    return new FieldValidationException("email", "A contact with this email already exists");
  }
}
