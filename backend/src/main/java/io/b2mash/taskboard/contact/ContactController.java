package io.b2mash.taskboard.contact;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ContactController {

  private static final String COLOR_PATTERN = "^#[0-9A-Fa-f]{6}$";
  private static final String NOT_BLANK_PATTERN = "(?s).*\\S.*";

  private final ContactService contactService;

  public ContactController(ContactService contactService) {
    this.contactService = contactService;
  }

  @GetMapping("/api/contacts")
  public ResponseEntity<List<ContactResponse>> listContacts() {
    var contacts = contactService.listContacts().stream().map(ContactResponse::from).toList();
    return ResponseEntity.ok(contacts);
  }

  @GetMapping("/api/contacts/{id}")
  public ResponseEntity<ContactResponse> getContact(@PathVariable Long id) {
    return ResponseEntity.ok(ContactResponse.from(contactService.getContact(id)));
  }

  @PostMapping("/api/contacts")
  public ResponseEntity<ContactResponse> createContact(
      @Valid @RequestBody ContactRequest request) {
    var contact =
        contactService.createContact(
            request.name(), request.email(), request.phone(), request.color());
    return ResponseEntity.created(URI.create("/api/contacts/" + contact.getId()))
        .body(ContactResponse.from(contact));
  }

  @PutMapping("/api/contacts/{id}")
  public ResponseEntity<ContactResponse> replaceContact(
      @PathVariable Long id, @Valid @RequestBody ContactRequest request) {
    var contact =
        contactService.updateContact(
            id, request.name(), request.email(), request.phone(), request.color());
    return ResponseEntity.ok(ContactResponse.from(contact));
  }

  @PatchMapping("/api/contacts/{id}")
  public ResponseEntity<ContactResponse> patchContact(
      @PathVariable Long id, @Valid @RequestBody ContactPatchRequest request) {
    var contact =
        contactService.updateContact(
            id, request.name(), request.email(), request.phone(), request.color());
    return ResponseEntity.ok(ContactResponse.from(contact));
  }

  @DeleteMapping("/api/contacts/{id}")
  public ResponseEntity<Void> deleteContact(@PathVariable Long id) {
    contactService.deleteContact(id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record ContactRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @NotBlank(message = "email is required")
          @Email(message = "email must be a valid email address")
          @Size(max = 254, message = "email must be at most 254 characters")
          String email,
      @NotBlank(message = "phone is required")
          @Size(max = 20, message = "phone must be at most 20 characters")
          String phone,
      @Pattern(regexp = COLOR_PATTERN, message = "color must be a hex color like #1A2B3C")
          String color) {}

  public record ContactPatchRequest(
      @Pattern(regexp = NOT_BLANK_PATTERN, message = "name must not be blank")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @Pattern(regexp = NOT_BLANK_PATTERN, message = "email must not be blank")
          @Email(message = "email must be a valid email address")
          @Size(max = 254, message = "email must be at most 254 characters")
          String email,
      @Pattern(regexp = NOT_BLANK_PATTERN, message = "phone must not be blank")
          @Size(max = 20, message = "phone must be at most 20 characters")
          String phone,
      @Pattern(regexp = COLOR_PATTERN, message = "color must be a hex color like #1A2B3C")
          String color) {}

  public record ContactResponse(Long id, String name, String email, String phone, String color) {

    public static ContactResponse from(Contact contact) {
      return new ContactResponse(
          contact.getId(),
          contact.getName(),
          contact.getEmail(),
          contact.getPhone(),
          contact.getColor());
    }
  }
}
