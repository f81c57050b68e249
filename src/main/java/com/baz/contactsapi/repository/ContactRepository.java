package com.baz.contactsapi.repository;

import com.baz.contactsapi.mapper.ContactRow;
import com.baz.contactsapi.model.entity.Contact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface ContactRepository extends JpaRepository<Contact, Long> {

    /**
     * Most recently created first. Rows sharing a creation timestamp fall back to
     * descending id, which follows insertion order.
     */
    List<Contact> findAllByOrderByCreatedAtDescIdDesc();

    /**
     * Replaces every mapped column of one contact and refreshes {@code updated_at} in a single
     * statement. Returns the number of rows changed, 0 when no contact has this id.
     */
    default int updateContactById(Long id, ContactRow row, LocalDateTime updatedAt) {
        return updateColumns(id,
                row.fullName(), row.email(), row.phone(), row.cell(), row.registeredDate(), row.age(),
                row.streetNumber(), row.streetName(), row.city(), row.country(),
                row.pictureLarge(), row.pictureMedium(), row.pictureThumbnail(),
                updatedAt);
    }

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE Contact c SET
            c.fullName = :fullName, c.email = :email, c.phone = :phone, c.cell = :cell,
            c.registeredDate = :registeredDate, c.age = :age,
            c.streetNumber = :streetNumber, c.streetName = :streetName,
            c.city = :city, c.country = :country,
            c.pictureLarge = :pictureLarge, c.pictureMedium = :pictureMedium,
            c.pictureThumbnail = :pictureThumbnail,
            c.updatedAt = :updatedAt
        WHERE c.id = :id
        """)
    int updateColumns(@Param("id") Long id,
                      @Param("fullName") String fullName,
                      @Param("email") String email,
                      @Param("phone") String phone,
                      @Param("cell") String cell,
                      @Param("registeredDate") String registeredDate,
                      @Param("age") Integer age,
                      @Param("streetNumber") Integer streetNumber,
                      @Param("streetName") String streetName,
                      @Param("city") String city,
                      @Param("country") String country,
                      @Param("pictureLarge") String pictureLarge,
                      @Param("pictureMedium") String pictureMedium,
                      @Param("pictureThumbnail") String pictureThumbnail,
                      @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * Hard delete as a single statement.
     * Returns the number of rows removed, 0 when no contact has this id.
     */
    @Modifying
    @Query("DELETE FROM Contact c WHERE c.id = :id")
    int deleteContactById(@Param("id") Long id);
}
