package com.nosota.msale.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "reward_balance",
        uniqueConstraints = @UniqueConstraint(columnNames = {"book_name", "account"}))
@Getter
@Setter
@NoArgsConstructor
public class RewardBalance {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "book_name", nullable = false, length = 100)
    private String bookName;

    @Column(name = "account", nullable = false)
    private String account;

    @Column(name = "balance", nullable = false)
    private Long balance;

    public RewardBalance(String bookName, String account) {
        this.bookName = bookName;
        this.account = account;
        this.balance = 0L;
    }
}
