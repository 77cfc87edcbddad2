/**
 * Background components that drive PROVISIONING requests to a terminal status.
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.StatusPoller} - periodic one-shot refresh of every
 *       PROVISIONING request</li>
 *   <li>{@link com.ryuqq.provisioner.adapter.runner.CompletionWatcher} - cancellable per-request wait</li>
 * </ul>
 */
package com.ryuqq.provisioner.adapter.runner;
