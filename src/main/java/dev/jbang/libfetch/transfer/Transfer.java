package dev.jbang.libfetch.transfer;

import dev.jbang.libfetch.session.Session;
import java.nio.file.Path;

/** The I/O primitive that moves one item from the remote source to a local file */
@FunctionalInterface
public interface Transfer {
	/**
	 * Fetch the item at the locator and store it at the destination.
	 *
	 * @param session The authenticated session to use
	 * @param locator Where the item lives remotely
	 * @param destination The file to write, only created when the transfer succeeds
	 * @return The number of bytes written
	 * @throws dev.jbang.libfetch.error.FetchException for any failure of the transfer
	 */
	long transfer(Session session, String locator, Path destination);
}
