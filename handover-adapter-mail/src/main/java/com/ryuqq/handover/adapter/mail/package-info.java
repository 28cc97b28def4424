/**
 * SMTP notification adapter (Jakarta Mail).
 */
package com.ryuqq.handover.adapter.mail;
