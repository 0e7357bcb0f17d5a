package dev.jbang.libfetch.error;

/** Kind of failure recorded against a work item as its last error */
public enum ErrorKind {
	AUTHENTICATION,
	ACCOUNT_LOCKED,
	TRANSIENT,
	VALIDATION,
	QUOTA_EXHAUSTED,
	PERMANENT,
	UNEXPECTED
}
