package com.caffe.emergency.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false)
    private String username;

    private String firstName;
    private String lastName;
    private String email;
    private String phone;
    private String parish;
    private String deviceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UserRole role;

    @Builder.Default
    private boolean active = true;

    public Recipient toRecipient() {
        String fullName = ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
        return Recipient.builder()
                .id(String.valueOf(id))
                .name(fullName.isEmpty() ? username : fullName)
                .phone(phone)
                .email(email)
                .deviceId(deviceId)
                .build();
    }
}
