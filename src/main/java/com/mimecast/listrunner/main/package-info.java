/**
 * The entry point and core components of the list runner.
 *
 * <p>This package contains the command line front ends and the shared component wiring.
 *
 * <h2>EntryCLI</h2>
 * <p>Queue entry invoked by the mail transport once per inbound message.
 * <br>The message is read from standard input and durably enqueued before the process exits.
 * <br>Exit codes follow sysexits so the transport retries on temporary failures.
 *
 * <p>In this example a post to the list {@code dev} is handed over by the transport:
 * <pre>
 *     java -jar listrunner.jar --entry --conf cfg/ --list dev --role post --sender alice@example.com &lt; message.eml
 * </pre>
 *
 * <h2>RunnerCLI</h2>
 * <p>Queue runners and maintenance.
 * <br>Either long lived, every configured runner on its own thread, or a single cycle for cron driven deployments.
 *
 * <h2>Foundation</h2>
 * <p>The foundation abstract ensures the site configuration is loaded just once.
 *
 * <h2>Factories</h2>
 * <p>For all pluggable components: the list directory, the switchboards and the clock.
 *
 * @see com.mimecast.listrunner.main.EntryCLI
 * @see com.mimecast.listrunner.main.RunnerCLI
 */
package com.mimecast.listrunner.main;
