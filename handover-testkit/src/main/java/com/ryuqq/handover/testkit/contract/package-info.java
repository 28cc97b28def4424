/**
 * SPI contract tests shared by adapters.
 *
 * @since 1.0.0
 */
package com.ryuqq.handover.testkit.contract;
