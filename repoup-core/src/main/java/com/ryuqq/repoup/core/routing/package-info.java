/**
 * Repository routing: ordered rules mapping (architecture, os_tag, format) to a storage prefix.
 *
 * @since 1.0.0
 * @author Repoup Team
 */
package com.ryuqq.repoup.core.routing;
