package dev.jbang.libfetch.queue;

import static org.assertj.core.api.Assertions.*;

import dev.jbang.libfetch.error.ErrorKind;
import java.io.IOException;
import java.lang.reflect.Method;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DownloadQueueTest {

	@TempDir
	Path tempDir;

	private JsonStatusStore store;

	@BeforeEach
	void setUp() {
		store = new JsonStatusStore(tempDir.resolve("status.json"));
	}

	@Test
	void testMissingStatusFileIsEmptyQueue() throws Exception {
		// When
		DownloadQueue queue = DownloadQueue.load(store);

		// Then
		assertThat(queue.size()).isZero();
		assertThat(queue.nextPending()).isEmpty();
	}

	@Test
	void testNextPendingFollowsInsertionOrder() throws Exception {
		// Given
		DownloadQueue queue = queueOf(item("b"), item("a"), item("c"));

		// When
		queue.markDone("b", "x@example.com", 2000, "b.pdf");

		// Then
		assertThat(queue.nextPending()).map(WorkItem::id).contains("a");
	}

	@Test
	void testInterruptedItemsAreRestoredOnLoad() throws Exception {
		// Given
		Files.writeString(store.statusFile(), """
				[
				  { "id": "1", "locator": "https://example.org/1", "status": "IN_PROGRESS", "attempts": 1 },
				  { "id": "2", "locator": "https://example.org/2", "status": "DONE", "attempts": 1 },
				  { "id": "3", "locator": "https://example.org/3", "cover_status": "IN_PROGRESS" }
				]
				""");

		// When
		DownloadQueue queue = DownloadQueue.load(store);

		// Then
		assertThat(queue.get("1")).map(WorkItem::status).contains(ItemStatus.PENDING);
		assertThat(queue.get("1")).map(WorkItem::attempts).contains(1);
		assertThat(queue.get("2")).map(WorkItem::status).contains(ItemStatus.DONE);
		assertThat(queue.get("3")).map(WorkItem::status).contains(ItemStatus.PENDING);
		assertThat(queue.get("3")).map(WorkItem::extension).contains(WorkItem.DEFAULT_EXTENSION);
		assertThat(queue.get("3")).map(WorkItem::coverStatus).contains(ItemStatus.PENDING);
		assertThat(queue.get("2")).map(WorkItem::coverStatus).contains(ItemStatus.PENDING);
	}

	@Test
	void testEveryChangeIsPersisted() throws Exception {
		// Given
		DownloadQueue queue = queueOf(item("1"), item("2"));

		// When
		queue.markInProgress("1");
		queue.recordAttempt("1", ErrorKind.TRANSIENT, "timeout");
		queue.markDone("1", "a@example.com", 12345, "One - Someone.pdf");
		queue.markInProgress("2");
		queue.recordAttempt("2", ErrorKind.PERMANENT, "HTTP status: 404");
		queue.markFailed("2", ErrorKind.PERMANENT, "HTTP status: 404");

		// Then
		DownloadQueue reloaded = DownloadQueue.load(store);
		WorkItem done = reloaded.get("1").orElseThrow();
		assertThat(done.status()).isEqualTo(ItemStatus.DONE);
		assertThat(done.attempts()).isEqualTo(2);
		assertThat(done.downloadAccount()).isEqualTo("a@example.com");
		assertThat(done.size()).isEqualTo(12345L);
		assertThat(done.lastError()).isNull();
		assertThat(done.file()).isEqualTo("One - Someone.pdf");

		WorkItem failed = reloaded.get("2").orElseThrow();
		assertThat(failed.status()).isEqualTo(ItemStatus.FAILED);
		assertThat(failed.attempts()).isEqualTo(1);
		assertThat(failed.lastError()).isEqualTo(ErrorKind.PERMANENT);
		assertThat(failed.lastErrorMessage()).isEqualTo("HTTP status: 404");
	}

	@Test
	void testStatusFileFormat() throws Exception {
		// Given
		DownloadQueue queue = queueOf(WorkItem.create("42", "https://example.org/42")
				.title("A Book")
				.author("Someone"));

		// When
		queue.markDone("42", "a@example.com", 5000, "A Book - Someone.pdf");

		// Then
		String json = Files.readString(store.statusFile());
		assertThat(json)
				.contains("\"status\" : \"DONE\"")
				.contains("\"download_account\" : \"a@example.com\"")
				.contains("\"title\" : \"A Book\"")
				.contains("\"file\" : \"A Book - Someone.pdf\"")
				.contains("\"cover_status\" : \"PENDING\"")
				.doesNotContain("last_error")
				.doesNotContain("runAttempts");
	}

	@Test
	void testRunAttemptsResetWhenItemStarts() throws Exception {
		// Given
		DownloadQueue queue = queueOf(item("1"));
		queue.markInProgress("1");
		queue.recordAttempt("1", ErrorKind.TRANSIENT, "timeout");
		queue.recordAttempt("1", ErrorKind.TRANSIENT, "timeout");

		// When
		queue.restore("1", ItemStatus.PENDING);
		queue.markInProgress("1");

		// Then
		WorkItem item = queue.get("1").orElseThrow();
		assertThat(item.attempts()).isEqualTo(2);
		assertThat(item.runAttempts()).isZero();
		assertThat(item.status()).isEqualTo(ItemStatus.IN_PROGRESS);
	}

	@Test
	void testRestoreKeepsEarlierFailure() throws Exception {
		// Given an item that failed in an earlier run and is attempted again
		DownloadQueue queue = queueOf(item("1"));
		queue.markFailed("1", ErrorKind.PERMANENT, "HTTP status: 410");
		queue.markInProgress("1");
		queue.recordAttempt("1", ErrorKind.TRANSIENT, "timeout");

		// When
		queue.restore("1", ItemStatus.FAILED);

		// Then
		WorkItem item = DownloadQueue.load(store).get("1").orElseThrow();
		assertThat(item.status()).isEqualTo(ItemStatus.FAILED);
		assertThat(item.attempts()).isEqualTo(1);
	}

	@Test
	void testRestoreRejectsInProgress() throws Exception {
		// Given
		DownloadQueue queue = queueOf(item("1"));

		// When/Then
		assertThatThrownBy(() -> queue.restore("1", ItemStatus.IN_PROGRESS))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> queue.restore("1", null)).isInstanceOf(IllegalArgumentException.class);
		assertThat(queue.get("1")).map(WorkItem::status).contains(ItemStatus.PENDING);
	}

	@Test
	void testFileOwner() throws Exception {
		// Given
		DownloadQueue queue = queueOf(item("1"), item("2"), item("3"));
		queue.markDone("1", "a@example.com", 2000, "Unknown - Unknown.pdf");
		queue.markSkipped("2", "Other - Someone.pdf");

		// When/Then
		assertThat(queue.fileOwner("Unknown - Unknown.pdf")).contains("1");
		assertThat(queue.fileOwner("Other - Someone.pdf")).contains("2");
		assertThat(queue.fileOwner("Nobody.pdf")).isEmpty();
	}

	@Test
	void testCoverStatusIsTrackedSeparately() throws Exception {
		// Given
		DownloadQueue queue = queueOf(item("1"), item("2"), item("3"));
		queue.markDone("1", "a@example.com", 2000, "1.pdf");

		// When
		queue.markCoverDone("2", "2.jpg");
		queue.markCoverFailed("3", ErrorKind.PERMANENT, "No cover URL");

		// Then
		DownloadQueue reloaded = DownloadQueue.load(store);
		assertThat(reloaded.nextPendingCover()).map(WorkItem::id).contains("1");
		assertThat(reloaded.nextPending()).map(WorkItem::id).contains("2");
		assertThat(reloaded.get("2")).map(WorkItem::coverFile).contains("2.jpg");
		assertThat(reloaded.get("3")).map(WorkItem::coverError).contains(ErrorKind.PERMANENT);
		assertThat(reloaded.coverFileOwner("2.jpg")).contains("2");
		Map<ItemStatus, Integer> coverCounts = reloaded.coverCountsByStatus();
		assertThat(coverCounts.get(ItemStatus.PENDING)).isEqualTo(1);
		assertThat(coverCounts.get(ItemStatus.DONE)).isEqualTo(1);
		assertThat(coverCounts.get(ItemStatus.FAILED)).isEqualTo(1);
	}

	@Test
	void testRequeueFailedCovers() throws Exception {
		// Given
		DownloadQueue queue = queueOf(item("1"), item("2"));
		queue.markFailed("1", ErrorKind.PERMANENT, "HTTP status: 404");
		queue.markCoverFailed("1", ErrorKind.TRANSIENT, "timeout");
		queue.markCoverSkipped("2", "2.jpg");

		// When
		int requeued = queue.requeueFailedCovers();

		// Then
		assertThat(requeued).isEqualTo(1);
		assertThat(queue.get("1")).map(WorkItem::coverStatus).contains(ItemStatus.PENDING);
		assertThat(queue.get("1")).map(WorkItem::status).contains(ItemStatus.FAILED);
		assertThat(queue.get("2")).map(WorkItem::coverStatus).contains(ItemStatus.SKIPPED);
	}

	@Test
	void testAddAllKeepsKnownItems() throws Exception {
		// Given
		DownloadQueue queue = queueOf(item("1"));
		queue.markDone("1", "a@example.com", 2000, "1.pdf");

		// When
		int added = queue.addAll(List.of(item("1"), item("2"), item("3").status(ItemStatus.DONE)));

		// Then
		assertThat(added).isEqualTo(2);
		assertThat(queue.get("1")).map(WorkItem::status).contains(ItemStatus.DONE);
		assertThat(queue.get("3")).map(WorkItem::status).contains(ItemStatus.PENDING);
		assertThat(DownloadQueue.load(store).size()).isEqualTo(3);
	}

	@Test
	void testRequeueFailed() throws Exception {
		// Given
		DownloadQueue queue = queueOf(item("1"), item("2"), item("3"));
		queue.markFailed("1", ErrorKind.TRANSIENT, "timeout");
		queue.markFailed("3", ErrorKind.VALIDATION, "too small");
		queue.markSkipped("2", "2.pdf");

		// When
		int requeued = queue.requeueFailed();

		// Then
		assertThat(requeued).isEqualTo(2);
		assertThat(queue.count(ItemStatus.PENDING)).isEqualTo(2);
		assertThat(queue.count(ItemStatus.SKIPPED)).isEqualTo(1);
	}

	@Test
	void testCountsByStatusHasAllStatuses() throws Exception {
		// Given
		DownloadQueue queue = queueOf(item("1"), item("2"));
		queue.markDone("1", "a@example.com", 2000, "1.pdf");

		// When
		Map<ItemStatus, Integer> counts = queue.countsByStatus();

		// Then
		assertThat(counts).containsOnlyKeys(ItemStatus.values());
		assertThat(counts.get(ItemStatus.DONE)).isEqualTo(1);
		assertThat(counts.get(ItemStatus.PENDING)).isEqualTo(1);
		assertThat(counts.get(ItemStatus.FAILED)).isZero();
	}

	@Test
	void testUnknownItem() throws Exception {
		// Given
		DownloadQueue queue = queueOf(item("1"));

		// When/Then
		assertThat(queue.get("nope")).isEmpty();
		assertThatThrownBy(() -> queue.markDone("nope", "a@example.com", 1, "nope.pdf"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Unknown item ID: nope");
	}

	@Test
	void testDuplicateIdsAreRejected() throws Exception {
		// Given
		store.save(List.of(item("1"), item("1")));

		// When/Then
		assertThatThrownBy(() -> DownloadQueue.load(store))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Duplicate");
	}

	@Test
	void testCompleteStatuses() {
		assertThat(ItemStatus.DONE.isComplete()).isTrue();
		assertThat(ItemStatus.SKIPPED.isComplete()).isTrue();
		assertThat(ItemStatus.FAILED.isComplete()).isFalse();
		assertThat(ItemStatus.PENDING.isComplete()).isFalse();
	}

	@Test
	void testStatusCanOnlyChangeThroughTheQueue() {
		List<String> publicSetters = Arrays.stream(WorkItem.class.getMethods())
				.filter(method -> method.getDeclaringClass() == WorkItem.class)
				.filter(method -> method.getParameterCount() > 0)
				.map(Method::getName)
				.filter(name -> !name.equals("equals") && !name.equals("create"))
				.toList();

		assertThat(publicSetters).containsExactlyInAnyOrder("title", "author", "locator", "extension", "coverUrl");
	}

	private DownloadQueue queueOf(WorkItem... items) throws IOException {
		store.save(List.of(items));
		return DownloadQueue.load(store);
	}

	private static WorkItem item(String id) {
		return WorkItem.create(id, "https://example.org/" + id);
	}
}
