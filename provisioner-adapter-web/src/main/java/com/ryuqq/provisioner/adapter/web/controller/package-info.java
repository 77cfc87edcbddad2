/**
 * REST controllers.
 */
package com.ryuqq.provisioner.adapter.web.controller;
