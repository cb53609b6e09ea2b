/**
 * Storage gateway decorators: bounded retry of transient storage errors.
 *
 * @author Repoup Team
 * @since 1.0.0
 */
package com.ryuqq.repoup.adapter.runner.storage;
