package com.baz.contactsapi.service;

import com.baz.contactsapi.exception.InvalidContactException;
import com.baz.contactsapi.mapper.ContactMapper;
import com.baz.contactsapi.mapper.ContactRow;
import com.baz.contactsapi.model.dto.ContactRequest;
import com.baz.contactsapi.model.dto.ContactResponse;
import com.baz.contactsapi.model.entity.Contact;
import com.baz.contactsapi.repository.ContactRepository;
import com.baz.contactsapi.validation.ContactValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
public class ContactService {

    private static final Logger log = LoggerFactory.getLogger(ContactService.class);
    static final String NOT_FOUND = "Contact not found";

    private final ContactRepository contactRepository;

    public ContactService(ContactRepository contactRepository) {
        this.contactRepository = contactRepository;
    }

    public List<ContactResponse> listContacts() {
        return contactRepository.findAllByOrderByCreatedAtDescIdDesc().stream()
                .map(ContactMapper::rowToDocument)
                .toList();
    }

    public ContactResponse getContact(String id) {
        return parseId(id)
                .flatMap(contactRepository::findById)
                .map(ContactMapper::rowToDocument)
                .orElseThrow(ContactService::notFound);
    }

    @Transactional
    public ContactResponse createContact(ContactRequest request) {
        log.debug("Received contact: {}", request);
        ContactRow row = toRow(request, request);

        Contact saved = contactRepository.saveAndFlush(Contact.fromRow(row));
        log.info("Created contact id={}", saved.getId());
        return ContactMapper.rowToDocument(saved);
    }

    /**
     * Replaces every mapped field of an existing contact with one UPDATE statement, then re-reads
     * the row. Validation runs first, so an invalid body is rejected even when the id does not exist.
     */
    @Transactional
    public ContactResponse updateContact(String id, ContactRequest request) {
        ContactRow row = toRow(request, null);

        Long contactId = parseId(id).orElseThrow(ContactService::notFound);
        if (contactRepository.updateContactById(contactId, row, LocalDateTime.now()) == 0) {
            throw notFound();
        }
        log.info("Updated contact id={}", contactId);
        return contactRepository.findById(contactId)
                .map(ContactMapper::rowToDocument)
                .orElseThrow(ContactService::notFound);
    }

    @Transactional
    public void deleteContact(String id) {
        Long contactId = parseId(id).orElseThrow(ContactService::notFound);
        if (contactRepository.deleteContactById(contactId) == 0) {
            throw notFound();
        }
        log.info("Deleted contact id={}", contactId);
    }

    /** {@code echo} is attached to the rejection so it can be returned to the client, or null. */
    private static ContactRow toRow(ContactRequest request, ContactRequest echo) {
        return ContactValidator.validate(request)
                .flatMap(ContactMapper::documentToRow)
                .orElseThrow(error -> {
                    log.info("Rejected contact: {}", error.message());
                    return new InvalidContactException(error, echo);
                });
    }

    /** Ids that are not integers cannot match a row; they resolve to "not found". */
    private static Optional<Long> parseId(String id) {
        try {
            return Optional.of(Long.parseLong(id.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static ResponseStatusException notFound() {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, NOT_FOUND);
    }
}
