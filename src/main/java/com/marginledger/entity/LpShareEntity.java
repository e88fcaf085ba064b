package com.marginledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Pool shares held by one liquidity provider. */
@Entity
@Table(name = "lp_shares")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LpShareEntity {

    @Id
    @Column(name = "investor_id", length = 64)
    private String investorId;

    private long shares;
}
