/**
 * {@link com.ryuqq.provisioner.core.spi.IdentityDirectory} over the directory service's JSON REST API.
 */
package com.ryuqq.provisioner.adapter.http.directory;
