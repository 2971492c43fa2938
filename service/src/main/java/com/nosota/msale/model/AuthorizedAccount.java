package com.nosota.msale.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "authorized_account",
        uniqueConstraints = @UniqueConstraint(columnNames = {"list_name", "account"}))
@Getter
@Setter
@NoArgsConstructor
public class AuthorizedAccount {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "list_name", nullable = false, length = 100)
    private String listName;

    @Column(name = "account", nullable = false)
    private String account;

    @Column(name = "authorized_at", nullable = false)
    private Instant authorizedAt;

    public AuthorizedAccount(String listName, String account, Instant authorizedAt) {
        this.listName = listName;
        this.account = account;
        this.authorizedAt = authorizedAt;
    }
}
