package dev.jbang.libfetch.engine;

import java.time.Duration;

/** Waits between attempts; replaced in tests so they run without real delays */
@FunctionalInterface
public interface Sleeper {
	Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

	void sleep(Duration duration) throws InterruptedException;
}
