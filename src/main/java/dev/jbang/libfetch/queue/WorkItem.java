package dev.jbang.libfetch.queue;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.jbang.libfetch.error.ErrorKind;
import java.util.Objects;

/**
 * One retrievable item and its download status, as kept in the status store. The descriptive
 * fields can be set while building an item for import; status fields only change through {@link
 * DownloadQueue}.
 */
@JsonPropertyOrder({
	"id",
	"title",
	"author",
	"locator",
	"extension",
	"status",
	"attempts",
	"last_error",
	"last_error_message",
	"download_account",
	"size",
	"file",
	"cover_url",
	"cover_status",
	"cover_file",
	"cover_error",
	"cover_error_message"
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkItem {
	public static final String DEFAULT_EXTENSION = "pdf";

	@JsonProperty("id")
	private String id;

	@JsonProperty("title")
	private String title;

	@JsonProperty("author")
	private String author;

	@JsonProperty("locator")
	private String locator;

	@JsonProperty("extension")
	private String extension;

	@JsonProperty("status")
	private ItemStatus status;

	@JsonProperty("attempts")
	private int attempts;

	@JsonProperty("last_error")
	private ErrorKind lastError;

	@JsonProperty("last_error_message")
	private String lastErrorMessage;

	@JsonProperty("download_account")
	private String downloadAccount;

	@JsonProperty("size")
	private Long size;

	/** Name of the file in the files directory that holds this item */
	@JsonProperty("file")
	private String file;

	@JsonProperty("cover_url")
	private String coverUrl;

	@JsonProperty("cover_status")
	private ItemStatus coverStatus;

	@JsonProperty("cover_file")
	private String coverFile;

	@JsonProperty("cover_error")
	private ErrorKind coverError;

	@JsonProperty("cover_error_message")
	private String coverErrorMessage;

	@JsonIgnore
	private transient int runAttempts;

	public WorkItem() {
		extension = DEFAULT_EXTENSION;
		status = ItemStatus.PENDING;
		coverStatus = ItemStatus.PENDING;
	}

	public static WorkItem create(String id, String locator) {
		return new WorkItem().id(id).locator(locator);
	}

	public String id() {
		return id;
	}

	WorkItem id(String id) {
		this.id = id;
		return this;
	}

	public String title() {
		return title;
	}

	public WorkItem title(String title) {
		this.title = title;
		return this;
	}

	public String author() {
		return author;
	}

	public WorkItem author(String author) {
		this.author = author;
		return this;
	}

	public String locator() {
		return locator;
	}

	public WorkItem locator(String locator) {
		this.locator = locator;
		return this;
	}

	public String extension() {
		return extension;
	}

	public WorkItem extension(String extension) {
		this.extension = extension;
		return this;
	}

	public String coverUrl() {
		return coverUrl;
	}

	public WorkItem coverUrl(String coverUrl) {
		this.coverUrl = coverUrl;
		return this;
	}

	public ItemStatus status() {
		return status;
	}

	WorkItem status(ItemStatus status) {
		this.status = status;
		return this;
	}

	public int attempts() {
		return attempts;
	}

	WorkItem attempts(int attempts) {
		this.attempts = attempts;
		return this;
	}

	public ErrorKind lastError() {
		return lastError;
	}

	public String lastErrorMessage() {
		return lastErrorMessage;
	}

	public String downloadAccount() {
		return downloadAccount;
	}

	public Long size() {
		return size;
	}

	public String file() {
		return file;
	}

	public ItemStatus coverStatus() {
		return coverStatus;
	}

	public String coverFile() {
		return coverFile;
	}

	public ErrorKind coverError() {
		return coverError;
	}

	public String coverErrorMessage() {
		return coverErrorMessage;
	}

	/** Attempts made on this item since the current run started working on it */
	public int runAttempts() {
		return runAttempts;
	}

	// Transitions, only used by DownloadQueue

	void startRun() {
		status = ItemStatus.IN_PROGRESS;
		runAttempts = 0;
	}

	void attempted(ErrorKind kind, String message) {
		attempts++;
		runAttempts++;
		lastError = kind;
		lastErrorMessage = message;
	}

	void done(String accountId, long size, String file) {
		status = ItemStatus.DONE;
		attempts++;
		runAttempts++;
		downloadAccount = accountId;
		this.size = size;
		this.file = file;
		lastError = null;
		lastErrorMessage = null;
	}

	void failed(ErrorKind kind, String message) {
		status = ItemStatus.FAILED;
		lastError = kind;
		lastErrorMessage = message;
	}

	void skipped(String file) {
		status = ItemStatus.SKIPPED;
		this.file = file;
		lastErrorMessage = "File already exists: " + file;
	}

	void restore(ItemStatus previous) {
		status = previous;
	}

	void pending() {
		status = ItemStatus.PENDING;
	}

	void coverDone(String coverFile) {
		coverStatus = ItemStatus.DONE;
		this.coverFile = coverFile;
		coverError = null;
		coverErrorMessage = null;
	}

	void coverSkipped(String coverFile) {
		coverStatus = ItemStatus.SKIPPED;
		this.coverFile = coverFile;
	}

	void restoreCover(ItemStatus previous) {
		coverStatus = previous;
	}

	void coverFailed(ErrorKind kind, String message) {
		coverStatus = ItemStatus.FAILED;
		coverError = kind;
		coverErrorMessage = message;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		WorkItem that = (WorkItem) o;
		return Objects.equals(id, that.id);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id);
	}

	@Override
	public String toString() {
		return "WorkItem{" + "id='" + id + '\'' + ", title='" + title + '\'' + ", status=" + status + ", attempts="
				+ attempts + ", lastError=" + lastError + ", coverStatus=" + coverStatus + '}';
	}
}
