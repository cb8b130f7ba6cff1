package junie.email.intel.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "users")
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
public class User {
    @Id
    private String id; // OAuth subject / internal UUID

    private String primaryEmail;

    private Instant createdAt;
}
