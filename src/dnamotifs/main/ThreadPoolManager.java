/*******************************************************************************
 * DNAMotifs - Search of gapped motifs in genomic sequences
 * Copyright 2026 DNAMotifs developers
 *
 * This file is part of DNAMotifs.
 *
 *     DNAMotifs is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     DNAMotifs is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with DNAMotifs.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package dnamotifs.main;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fixed size pool of threads with a bounded number of queued tasks.
 * Scanning tasks are independent, so the pool is simply drained when the queue is full
 */
public class ThreadPoolManager {
	private static final int TIMEOUT_SECONDS = 30;

	private final int numThreads;
	private final int maxTaskCount;
	private long maxWaitSeconds = 3600;
	private ThreadPoolExecutor pool;

	public ThreadPoolManager(int numThreads, int maxTaskCount) {
		if(numThreads<1) throw new IllegalArgumentException("Number of threads must be positive. Given: "+numThreads);
		this.numThreads = numThreads;
		this.maxTaskCount = maxTaskCount;
		this.pool = createPool();
	}

	public long getMaxWaitSeconds() {
		return maxWaitSeconds;
	}
	public void setMaxWaitSeconds(long maxWaitSeconds) {
		this.maxWaitSeconds = maxWaitSeconds;
	}

	/**
	 * Adds a task to the pool. If the queue is full, waits for the queued tasks to finish
	 * and starts a new pool before adding the task
	 * @param task to execute
	 * @throws InterruptedException if the wait for queued tasks is interrupted
	 */
	public void queueTask(Runnable task) throws InterruptedException {
		if(pool.getQueue().size() >= maxTaskCount) {
			terminatePool();
			pool = createPool();
		}
		pool.execute(task);
	}

	/**
	 * Shuts down the pool and waits for the queued tasks to finish
	 * @throws InterruptedException if the wait is interrupted or if the tasks do not finish in time
	 */
	public void terminatePool() throws InterruptedException  {
		pool.shutdown();
		pool.awaitTermination(maxWaitSeconds, TimeUnit.SECONDS);
		if(!pool.isTerminated()) {
			throw new InterruptedException("Tasks did not finish after waiting "+maxWaitSeconds+" seconds");
		}
	}

	private ThreadPoolExecutor createPool() {
		return new ThreadPoolExecutor(numThreads, numThreads, TIMEOUT_SECONDS, TimeUnit.SECONDS, new LinkedBlockingQueue<Runnable>());
	}
}
