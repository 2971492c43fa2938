package com.nosota.msale.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A named set of accounts allowed to contribute. Only the owner may change its members.
 */
@Entity
@Table(name = "authorization_list")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class AuthorizationList {
    @Id
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "owner", nullable = false)
    private String owner;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
