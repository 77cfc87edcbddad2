/**
 * Scheduled background reconciliation.
 */
package com.ryuqq.provisioner.adapter.web.scheduler;
