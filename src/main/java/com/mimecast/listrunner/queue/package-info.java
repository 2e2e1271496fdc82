/**
 * Durable message queues.
 *
 * <p>A {@link com.mimecast.listrunner.queue.Switchboard} holds the messages of one queue kind.
 * <br>The default {@link com.mimecast.listrunner.queue.FileSwitchboard} keeps one directory per kind under the queue root.
 *
 * <h2>Entry layout:</h2>
 * <ul>
 *     <li><b>&lt;id&gt;.msg</b> - raw message bytes, never modified after enqueue</li>
 *     <li><b>&lt;id&gt;.json</b> - metadata, the visibility marker, replaced by rename</li>
 *     <li><b>&lt;id&gt;.lck</b> - ownership marker, locked while a runner processes the entry</li>
 * </ul>
 *
 * <p>Both halves are written to {@code tmp/} and renamed into place, the payload first.
 * <br>Entries failing too often move unchanged into the {@code shunt} queue.
 *
 * <p>The {@link com.mimecast.listrunner.queue.InMemorySwitchboard} implements the same contract for tests.
 */
package com.mimecast.listrunner.queue;
