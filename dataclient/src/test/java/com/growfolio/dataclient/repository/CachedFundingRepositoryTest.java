package com.growfolio.dataclient.repository;

import com.growfolio.common.dto.Requests.ConfirmTransferRequest;
import com.growfolio.common.dto.Requests.TransferRequest;
import com.growfolio.common.enums.TransferStatus;
import com.growfolio.common.enums.TransferType;
import com.growfolio.common.exception.ApiExceptions.DomainRuleViolationException;
import com.growfolio.common.model.FundingBalance;
import com.growfolio.common.model.FxRate;
import com.growfolio.common.model.Page;
import com.growfolio.common.model.Transfer;
import com.growfolio.dataclient.remote.FundingRemoteDataSource;
import com.growfolio.dataclient.support.SyncFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachedFundingRepositoryTest {

    @Mock
    private FundingRemoteDataSource remote;

    private SyncFixture fixture;
    private CachedFundingRepository repository;

    @BeforeEach
    void setUp() {
        fixture = new SyncFixture();
        repository = new CachedFundingRepository(remote, fixture.stores(), fixture.rules(), "GBP", 100);
    }

    private static FundingBalance balance(String gbp) {
        return FundingBalance.builder().id("b1").availableGbp(new BigDecimal(gbp)).availableUsd(BigDecimal.ZERO).build();
    }

    private static Transfer transfer(String id, TransferType type, TransferStatus status, String amount) {
        return Transfer.builder().id(id).type(type).status(status).amount(new BigDecimal(amount)).currency("GBP").build();
    }

    // ==================== DEPOSITS ====================

    @Nested
    @DisplayName("Deposits")
    class Deposits {

        @Test
        @DisplayName("Successful deposit clears the balance and prepends the transfer")
        void depositClearsBalanceAndPrepends() {
            // Given
            when(remote.getBalance()).thenReturn(balance("100"), balance("150"));
            when(remote.listTransfers(1, 100)).thenReturn(new Page<>(List.of(
                    transfer("t0", TransferType.DEPOSIT, TransferStatus.COMPLETED, "10")), null));
            Transfer created = transfer("t1", TransferType.DEPOSIT, TransferStatus.PENDING, "50");
            when(remote.initiateDeposit(any())).thenReturn(created);
            repository.fetchBalance();
            repository.fetchAllTransfers();

            // When
            repository.initiateDeposit(new BigDecimal("50"), "top up");

            // Then
            assertThat(repository.fetchBalance().available("GBP")).isEqualByComparingTo("150");
            verify(remote, times(2)).getBalance();
            assertThat(repository.fetchAllTransfers()).extracting(Transfer::id).containsExactly("t1", "t0");
            verify(remote, times(1)).listTransfers(1, 100);
        }

        @Test
        @DisplayName("Deposit request carries the configured currency")
        void depositUsesCurrency() {
            when(remote.initiateDeposit(any())).thenReturn(transfer("t1", TransferType.DEPOSIT, TransferStatus.PENDING, "25"));

            repository.initiateDeposit(new BigDecimal("25"), null);

            ArgumentCaptor<TransferRequest> request = ArgumentCaptor.forClass(TransferRequest.class);
            verify(remote).initiateDeposit(request.capture());
            assertThat(request.getValue().currency()).isEqualTo("GBP");
        }

        @Test
        @DisplayName("Non-positive amount is rejected before any request")
        void zeroAmountRejected() {
            assertThatThrownBy(() -> repository.initiateDeposit(BigDecimal.ZERO, null))
                    .isInstanceOf(DomainRuleViolationException.class)
                    .extracting(e -> ((DomainRuleViolationException) e).getRuleCode())
                    .isEqualTo(DomainRules.INVALID_AMOUNT);
            verify(remote, never()).initiateDeposit(any());
        }

        @Test
        @DisplayName("Confirm replaces the transfer in the cached list")
        void confirmReplacesTransfer() {
            when(remote.listTransfers(1, 100)).thenReturn(new Page<>(List.of(
                    transfer("t1", TransferType.DEPOSIT, TransferStatus.PENDING, "50")), null));
            when(remote.confirmDeposit(any(ConfirmTransferRequest.class)))
                    .thenReturn(transfer("t1", TransferType.DEPOSIT, TransferStatus.COMPLETED, "50"));
            repository.fetchAllTransfers();

            repository.confirmDeposit("t1", new BigDecimal("1.27"));

            assertThat(repository.fetchAllTransfers()).extracting(Transfer::status).containsExactly(TransferStatus.COMPLETED);
            assertThat(repository.summary().totalDeposits()).isEqualByComparingTo("50");
        }
    }

    // ==================== READS RACING MUTATIONS ====================

    @Nested
    @DisplayName("Reads racing mutations")
    class ReadsRacingMutations {

        @Test
        @DisplayName("Balance read in flight across a deposit does not cache the pre-deposit balance")
        void inFlightBalanceReadIsNotCachedAfterDeposit() throws Exception {
            // Given: the first balance read blocks inside the remote call
            CountDownLatch readEntered = new CountDownLatch(1);
            CountDownLatch releaseRead = new CountDownLatch(1);
            AtomicInteger reads = new AtomicInteger();
            when(remote.getBalance()).thenAnswer(invocation -> {
                if (reads.incrementAndGet() == 1) {
                    readEntered.countDown();
                    releaseRead.await(5, TimeUnit.SECONDS);
                    return balance("100");
                }
                return balance("150");
            });
            when(remote.initiateDeposit(any())).thenReturn(
                    transfer("t1", TransferType.DEPOSIT, TransferStatus.PENDING, "50"));
            ExecutorService reader = Executors.newSingleThreadExecutor();
            try {
                Future<FundingBalance> earlyRead = reader.submit(repository::fetchBalance);
                assertThat(readEntered.await(5, TimeUnit.SECONDS)).isTrue();

                // When: a deposit lands while the read is still on the wire
                repository.initiateDeposit(new BigDecimal("50"), "top up");
                releaseRead.countDown();
                FundingBalance early = earlyRead.get(5, TimeUnit.SECONDS);
                FundingBalance afterDeposit = repository.fetchBalance();

                // Then
                assertThat(early.availableGbp()).isEqualByComparingTo("100");
                assertThat(afterDeposit.availableGbp()).isEqualByComparingTo("150");
                verify(remote, times(2)).getBalance();
            } finally {
                reader.shutdownNow();
            }
        }
    }

    // ==================== WITHDRAWALS ====================

    @Nested
    @DisplayName("Withdrawals")
    class Withdrawals {

        @Test
        @DisplayName("Withdrawal above available balance is refused without calling the API")
        void insufficientFunds() {
            when(remote.getBalance()).thenReturn(balance("40"));

            assertThatThrownBy(() -> repository.initiateWithdrawal(new BigDecimal("50"), null))
                    .isInstanceOf(DomainRuleViolationException.class)
                    .extracting(e -> ((DomainRuleViolationException) e).getRuleCode())
                    .isEqualTo(DomainRules.INSUFFICIENT_FUNDS);
            verify(remote, never()).initiateWithdrawal(any());
        }

        @Test
        @DisplayName("Withdrawal within balance goes through")
        void withinBalance() {
            when(remote.getBalance()).thenReturn(balance("100"));
            when(remote.initiateWithdrawal(any())).thenReturn(transfer("w1", TransferType.WITHDRAWAL, TransferStatus.PENDING, "60"));

            Transfer result = repository.initiateWithdrawal(new BigDecimal("60"), null);

            assertThat(result.id()).isEqualTo("w1");
        }
    }

    // ==================== CANCELLATION ====================

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Completed transfer cannot be cancelled")
        void completedNotCancellable() {
            when(remote.listTransfers(1, 100)).thenReturn(new Page<>(List.of(
                    transfer("t1", TransferType.DEPOSIT, TransferStatus.COMPLETED, "50")), null));
            repository.fetchAllTransfers();

            assertThatThrownBy(() -> repository.cancelTransfer("t1"))
                    .isInstanceOf(DomainRuleViolationException.class)
                    .extracting(e -> ((DomainRuleViolationException) e).getRuleCode())
                    .isEqualTo(DomainRules.TRANSFER_NOT_CANCELLABLE);
            verify(remote, never()).cancelTransfer(any());
        }

        @Test
        @DisplayName("Stale cached status still guards cancellation")
        void staleStatusStillChecked() {
            when(remote.listTransfers(1, 100)).thenReturn(new Page<>(List.of(
                    transfer("t1", TransferType.DEPOSIT, TransferStatus.FAILED, "50")), null));
            repository.fetchAllTransfers();
            fixture.advance(Duration.ofMinutes(10));

            assertThatThrownBy(() -> repository.cancelTransfer("t1")).isInstanceOf(DomainRuleViolationException.class);
        }

        @Test
        @DisplayName("Unknown transfer is left for the server to judge")
        void unknownTransferSent() {
            when(remote.cancelTransfer("t9")).thenReturn(transfer("t9", TransferType.DEPOSIT, TransferStatus.CANCELLED, "5"));

            assertThat(repository.cancelTransfer("t9").status()).isEqualTo(TransferStatus.CANCELLED);
        }
    }

    // ==================== FX RATE ====================

    @Nested
    @DisplayName("FX rate")
    class FxRates {

        @Test
        @DisplayName("Rate stays fresh until its own expiry")
        void freshUntilExpiry() {
            FxRate rate = new FxRate("GBP", "USD", new BigDecimal("1.27"), null, fixture.now(),
                    fixture.now().plusSeconds(10));
            when(remote.getFxRate()).thenReturn(rate);

            repository.fetchFxRate();
            fixture.advance(Duration.ofSeconds(9));
            repository.fetchFxRate();
            verify(remote, times(1)).getFxRate();

            fixture.advance(Duration.ofSeconds(2));
            repository.fetchFxRate();
            verify(remote, times(2)).getFxRate();
        }

        @Test
        @DisplayName("Already expired rate is not reused")
        void expiredRateNotReused() {
            FxRate expired = new FxRate("GBP", "USD", new BigDecimal("1.27"), null, fixture.now(),
                    fixture.now().minusSeconds(1));
            when(remote.getFxRate()).thenReturn(expired);

            repository.fetchFxRate();
            fixture.advance(Duration.ofMillis(1));
            repository.fetchFxRate();

            verify(remote, times(2)).getFxRate();
        }
    }

    @Test
    @DisplayName("Derived views read the cached list without loading")
    void derivedViewsDoNotLoad() {
        assertThat(repository.pendingTransfers()).isEmpty();
        verify(remote, never()).listTransfers(anyInt(), anyInt());
    }
}
