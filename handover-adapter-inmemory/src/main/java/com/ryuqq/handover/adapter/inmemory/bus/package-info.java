/**
 * In-memory Bus adapter.
 *
 * @since 1.0.0
 */
package com.ryuqq.handover.adapter.inmemory.bus;
