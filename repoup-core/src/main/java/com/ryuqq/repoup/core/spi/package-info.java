/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the capabilities the engine consumes from its environment. Adapter
 * modules provide the concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.repoup.core.spi.ObjectStorage} - get/put/list/delete with per-object conditional put</li>
 *   <li>{@link com.ryuqq.repoup.core.spi.MetadataGenerator} - package set to format-specific index components</li>
 *   <li>{@link com.ryuqq.repoup.core.spi.SigningTool} - scoped key import, package and detached signing, verification</li>
 *   <li>{@link com.ryuqq.repoup.core.spi.CacheInvalidator} - CDN invalidation after publication</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Substitutable:</strong> every capability can be replaced by a fake, so ordering,
 *       atomicity and rollback of the engine are testable without external binaries</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Repoup Team
 */
package com.ryuqq.repoup.core.spi;
