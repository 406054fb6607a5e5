package com.silentrisk.worker.passport;

import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.worker.collector.EthereumRpcClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CommitmentPassportIssuer Unit Tests")
class CommitmentPassportIssuerTest {

    private static final String COMMITMENT = "0x" + "3c".repeat(32);
    private static final String VAULT = "0x5fbdb2315678afecb367f032d93f642f64180aa3";

    @Mock
    private EthereumRpcClient rpcClient;

    private CommitmentPassportIssuer issuer;

    @BeforeEach
    void setUp() {
        SilentRiskProperties properties = new SilentRiskProperties();
        properties.getPassport().setVaultAddress(VAULT);
        issuer = new CommitmentPassportIssuer(rpcClient, properties);
    }

    @Test
    @DisplayName("Should issue claimable passport metadata at the current block")
    void shouldIssuePassport() {
        // Given
        when(rpcClient.blockNumber()).thenReturn(19_000_000L);

        // When
        Passport passport = issuer.issue(COMMITMENT, 4200);

        // Then
        assertThat(passport.getCommitment()).isEqualTo(COMMITMENT);
        assertThat(passport.getNullifierHash()).matches("^0x[0-9a-f]{64}$");
        assertThat(passport.getVaultAddress()).isEqualTo(VAULT);
        assertThat(passport.getBlockHeight()).isEqualTo(19_000_000L);
        assertThat(passport.getRiskScore()).isEqualTo(4200);
        assertThat(passport.getStatus()).isEqualTo(Passport.READY_TO_CLAIM);
        assertThat(passport.getTxHash()).isNull();
    }

    @Test
    @DisplayName("Should salt the nullifier so repeated issues for one commitment differ")
    void shouldSaltNullifier() {
        // Given
        when(rpcClient.blockNumber()).thenReturn(19_000_000L);

        // When
        Passport first = issuer.issue(COMMITMENT, 4200);
        Passport second = issuer.issue(COMMITMENT, 4200);

        // Then
        assertThat(first.getNullifierHash()).isNotEqualTo(second.getNullifierHash());
    }

    @Test
    @DisplayName("Should reject scores outside 0-10000")
    void shouldRejectOutOfRangeScore() {
        assertThatThrownBy(() -> issuer.issue(COMMITMENT, 10_001)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> issuer.issue(COMMITMENT, -1)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(rpcClient);
    }
}
