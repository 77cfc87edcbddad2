/**
 * Request and response bodies of the REST surface.
 */
package com.ryuqq.provisioner.adapter.web.dto;
