package medikariyer.client.core.retry;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RetryLedger 테스트")
class RetryLedgerTest {

  private final RetryLedger ledger = new RetryLedger();

  @Test
  @DisplayName("같은 요청은 한 번만 재시도 허용")
  void sameRequest_retriedAtMostOnce() {
    assertThat(ledger.tryMarkRetried("req-1")).isTrue();
    assertThat(ledger.tryMarkRetried("req-1")).isFalse();
    assertThat(ledger.size()).isEqualTo(1);
  }

  @Test
  @DisplayName("서로 다른 요청은 독립적으로 기록")
  void differentRequests_areIndependent() {
    assertThat(ledger.tryMarkRetried("req-1")).isTrue();
    assertThat(ledger.tryMarkRetried("req-2")).isTrue();
    assertThat(ledger.size()).isEqualTo(2);
  }

  @Test
  @DisplayName("release 후에는 기록이 남지 않음")
  void release_removesEntry() {
    ledger.tryMarkRetried("req-1");

    ledger.release("req-1");

    assertThat(ledger.size()).isZero();
    assertThat(ledger.tryMarkRetried("req-1")).isTrue();
  }

  @Test
  @DisplayName("동시에 같은 id를 기록해도 한 스레드만 성공")
  void concurrentMarks_onlyOneWins() throws InterruptedException {
    int threads = 16;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    CountDownLatch done = new CountDownLatch(threads);
    AtomicInteger winners = new AtomicInteger();

    for (int i = 0; i < threads; i++) {
      pool.submit(
          () -> {
            try {
              start.await();
              if (ledger.tryMarkRetried("shared")) {
                winners.incrementAndGet();
              }
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            } finally {
              done.countDown();
            }
          });
    }
    start.countDown();
    done.await(2, TimeUnit.SECONDS);
    pool.shutdownNow();

    assertThat(winners).hasValue(1);
  }
}
