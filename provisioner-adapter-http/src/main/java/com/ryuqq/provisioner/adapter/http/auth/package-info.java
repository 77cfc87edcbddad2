/**
 * Bearer token sources for the HTTP adapters.
 */
package com.ryuqq.provisioner.adapter.http.auth;
