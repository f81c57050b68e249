package com.baz.contactsapi.controller;

import com.baz.contactsapi.model.dto.ApiEnvelope;
import com.baz.contactsapi.model.dto.ContactRequest;
import com.baz.contactsapi.model.dto.ContactResponse;
import com.baz.contactsapi.service.ContactService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/contacts")
@CrossOrigin(origins = "*")
@Tag(name = "Contacts", description = "Contact management")
public class ContactController {

    private final ContactService contactService;

    public ContactController(ContactService contactService) {
        this.contactService = contactService;
    }

    @GetMapping
    @Operation(summary = "List all contacts, most recently created first")
    @ApiResponse(responseCode = "200", description = "Contacts")
    public ApiEnvelope<List<ContactResponse>> listContacts() {
        return ApiEnvelope.ofList(contactService.listContacts());
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a contact by id")
    @ApiResponse(responseCode = "200", description = "Contact")
    @ApiResponse(responseCode = "404", description = "Contact not found")
    public ApiEnvelope<ContactResponse> getContact(@PathVariable String id) {
        return ApiEnvelope.of(contactService.getContact(id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a new contact")
    @ApiResponse(responseCode = "201", description = "Contact created")
    @ApiResponse(responseCode = "400", description = "Validation error")
    public ApiEnvelope<ContactResponse> createContact(@RequestBody ContactRequest request) {
        return ApiEnvelope.of(contactService.createContact(request), "Contact created successfully");
    }

    @PutMapping("/{id}")
    @Operation(summary = "Replace all fields of an existing contact")
    @ApiResponse(responseCode = "200", description = "Contact updated")
    @ApiResponse(responseCode = "400", description = "Validation error")
    @ApiResponse(responseCode = "404", description = "Contact not found")
    public ApiEnvelope<ContactResponse> updateContact(@PathVariable String id,
                                                      @RequestBody ContactRequest request) {
        return ApiEnvelope.of(contactService.updateContact(id, request), "Contact updated successfully");
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a contact")
    @ApiResponse(responseCode = "200", description = "Contact deleted")
    @ApiResponse(responseCode = "404", description = "Contact not found")
    public ApiEnvelope<Void> deleteContact(@PathVariable String id) {
        contactService.deleteContact(id);
        return ApiEnvelope.message("Contact deleted successfully");
    }
}
