package com.resumeparse.core.batch;

import com.resumeparse.core.model.BatchEntry;
import com.resumeparse.core.model.BatchResult;
import com.resumeparse.core.model.CandidateRecord;
import com.resumeparse.core.model.Outcome;
import com.resumeparse.core.model.ParseUnit;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class BatchSchedulerTest {

    private static List<BatchEntry> echo(List<ParseUnit> chunk) {
        List<BatchEntry> entries = new ArrayList<>();
        for (ParseUnit unit : chunk) {
            entries.add(new BatchEntry(unit.getIndex(),
                CandidateRecord.builder().firstName(unit.getText()).build(), Outcome.OK));
        }
        return entries;
    }

    private static List<String> inputs(int count) {
        return IntStream.range(0, count).mapToObj(i -> "doc-" + i).toList();
    }

    @Test
    void resultsFollowInputOrderWhenLaterChunksFinishFirst() {
        BatchScheduler scheduler = new BatchScheduler(chunk -> {
            // earlier chunks sleep longer
            sleepQuietly(Math.max(0, 200 - chunk.get(0).getIndex() * 20L));
            return echo(chunk);
        }, Duration.ofSeconds(10), Duration.ZERO);

        BatchResult result = scheduler.run(inputs(10), 2, 5);

        assertThat(result.size()).isEqualTo(10);
        assertThat(result.records()).extracting(CandidateRecord::getFirstName)
            .containsExactlyElementsOf(inputs(10));
        assertThat(result.extractedCount()).isEqualTo(10);
    }

    @Test
    void failingChunkOnlyAffectsItsOwnPositions() {
        BatchScheduler scheduler = new BatchScheduler(chunk -> {
            if (chunk.get(0).getIndex() == 2) {
                throw new IllegalStateException("boom");
            }
            return echo(chunk);
        }, Duration.ofSeconds(10), Duration.ZERO);

        BatchResult result = scheduler.run(inputs(5), 2, 2);

        assertThat(result.getEntries()).extracting(BatchEntry::getOutcome).containsExactly(
            Outcome.OK, Outcome.OK, Outcome.EXTRACTION_FAILED, Outcome.EXTRACTION_FAILED, Outcome.OK);
        assertThat(result.get(2).getRecord().isEmpty()).isTrue();
        assertThat(result.get(4).getRecord().getFirstName()).isEqualTo("doc-4");
    }

    @Test
    void slowChunkIsCancelledAndSiblingsSurvive() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        BatchScheduler scheduler = new BatchScheduler(chunk -> {
            if (chunk.get(0).getIndex() == 0) {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
            }
            return echo(chunk);
        }, Duration.ofMillis(300), Duration.ZERO);

        long start = System.currentTimeMillis();
        BatchResult result = scheduler.run(inputs(4), 2, 2);

        assertThat(System.currentTimeMillis() - start).isLessThan(5_000);
        assertThat(result.getEntries()).extracting(BatchEntry::getOutcome).containsExactly(
            Outcome.EXTRACTION_FAILED, Outcome.EXTRACTION_FAILED, Outcome.OK, Outcome.OK);
        assertThat(result.get(0).getRecord()).isEqualTo(CandidateRecord.empty());
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void timeoutIsMeasuredFromChunkStartNotSubmission() {
        // one worker, three chunks of 200ms each; a submission-based clock would expire the last one
        BatchScheduler scheduler = new BatchScheduler(chunk -> {
            sleepQuietly(200);
            return echo(chunk);
        }, Duration.ofMillis(450), Duration.ZERO);

        BatchResult result = scheduler.run(inputs(3), 1, 1);

        assertThat(result.extractedCount()).isEqualTo(3);
    }

    @Test
    void concurrencyNeverExceedsWorkerCount() {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        BatchScheduler scheduler = new BatchScheduler(chunk -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            sleepQuietly(50);
            active.decrementAndGet();
            return echo(chunk);
        }, Duration.ofSeconds(10), Duration.ZERO);

        scheduler.run(inputs(12), 1, 3);

        assertThat(peak.get()).isBetween(1, 3);
    }

    @Test
    void missingEntriesAreFilledAsFailed() {
        BatchScheduler scheduler = new BatchScheduler(chunk -> echo(chunk.subList(0, 1)),
            Duration.ofSeconds(10), Duration.ZERO);

        BatchResult result = scheduler.run(inputs(2), 2, 1);

        assertThat(result.get(0).getOutcome()).isEqualTo(Outcome.OK);
        assertThat(result.get(1).getOutcome()).isEqualTo(Outcome.EXTRACTION_FAILED);
    }

    @Test
    void emptyInputAndInvalidSizes() {
        BatchScheduler scheduler = new BatchScheduler(BatchSchedulerTest::echo, Duration.ofSeconds(10), Duration.ZERO);

        assertThat(scheduler.run(Collections.emptyList(), 5, 4).size()).isZero();
        assertThat(scheduler.run(null, 5, 4).size()).isZero();
        assertThat(scheduler.run(inputs(3), 0, -1).extractedCount()).isEqualTo(3);
    }

    @Test
    void partitionKeepsIndicesContiguous() {
        List<List<ParseUnit>> chunks = BatchScheduler.partition(inputs(7), 3);

        assertThat(chunks).hasSize(3);
        assertThat(chunks.get(2)).extracting(ParseUnit::getIndex).containsExactly(6);
        assertThat(chunks.get(1)).extracting(ParseUnit::getIndex).containsExactly(3, 4, 5);
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
