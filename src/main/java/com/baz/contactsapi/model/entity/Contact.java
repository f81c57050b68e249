package com.baz.contactsapi.model.entity;

import com.baz.contactsapi.mapper.ContactRow;
import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "contacts")
public class Contact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String fullName;

    @Column(nullable = false)
    private String email;

    private String phone;

    private String cell;

    @Column(nullable = false)
    private String registeredDate;

    private Integer age;

    private Integer streetNumber;

    private String streetName;

    private String city;

    private String country;

    private String pictureLarge;

    private String pictureMedium;

    private String pictureThumbnail;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    void prePersist() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    public Contact() {}

    public static Contact fromRow(ContactRow row) {
        Contact contact = new Contact();
        contact.apply(row);
        return contact;
    }

    /** Overwrites every mapped column; identity and timestamps are left alone. */
    private void apply(ContactRow row) {
        this.fullName = row.fullName();
        this.email = row.email();
        this.phone = row.phone();
        this.cell = row.cell();
        this.registeredDate = row.registeredDate();
        this.age = row.age();
        this.streetNumber = row.streetNumber();
        this.streetName = row.streetName();
        this.city = row.city();
        this.country = row.country();
        this.pictureLarge = row.pictureLarge();
        this.pictureMedium = row.pictureMedium();
        this.pictureThumbnail = row.pictureThumbnail();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getFullName() { return fullName; }
    public void setFullName(String fullName) { this.fullName = fullName; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public String getPhone() { return phone; }
    public void setPhone(String phone) { this.phone = phone; }

    public String getCell() { return cell; }
    public void setCell(String cell) { this.cell = cell; }

    public String getRegisteredDate() { return registeredDate; }
    public void setRegisteredDate(String registeredDate) { this.registeredDate = registeredDate; }

    public Integer getAge() { return age; }
    public void setAge(Integer age) { this.age = age; }

    public Integer getStreetNumber() { return streetNumber; }
    public void setStreetNumber(Integer streetNumber) { this.streetNumber = streetNumber; }

    public String getStreetName() { return streetName; }
    public void setStreetName(String streetName) { this.streetName = streetName; }

    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }

    public String getCountry() { return country; }
    public void setCountry(String country) { this.country = country; }

    public String getPictureLarge() { return pictureLarge; }
    public void setPictureLarge(String pictureLarge) { this.pictureLarge = pictureLarge; }

    public String getPictureMedium() { return pictureMedium; }
    public void setPictureMedium(String pictureMedium) { this.pictureMedium = pictureMedium; }

    public String getPictureThumbnail() { return pictureThumbnail; }
    public void setPictureThumbnail(String pictureThumbnail) { this.pictureThumbnail = pictureThumbnail; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
}
