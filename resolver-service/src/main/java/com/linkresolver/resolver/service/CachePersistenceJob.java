package com.linkresolver.resolver.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic cache snapshot writer. Runs on its own scheduler thread; the save task takes a copy of the
 * cache under its lock and serializes outside it.
 */
@Slf4j
public class CachePersistenceJob {

	private final TaskScheduler scheduler;
	private final Duration interval;
	private final Clock clock;

	private ScheduledFuture<?> future;

	public CachePersistenceJob(TaskScheduler scheduler, Duration interval, Clock clock) {
		this.scheduler = scheduler;
		this.interval = interval;
		this.clock = clock;
	}

	public synchronized void start(Runnable saveTask) {
		if (future != null) {
			return;
		}
		future = scheduler.scheduleWithFixedDelay(() -> {
			try {
				saveTask.run();
			} catch (Exception e) {
				log.warn("Scheduled cache save failed", e);
			}
		}, clock.instant().plus(interval), interval);
		log.info("Cache persistence scheduled every {}s", interval.toSeconds());
	}

	public synchronized void stop() {
		if (future != null) {
			future.cancel(false);
			future = null;
			log.debug("Cache persistence timer cancelled");
		}
	}

	public synchronized boolean isRunning() {
		return future != null && !future.isDone();
	}
}
