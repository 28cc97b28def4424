/**
 * JDBC source database existence check.
 */
package com.ryuqq.handover.adapter.jdbc;
