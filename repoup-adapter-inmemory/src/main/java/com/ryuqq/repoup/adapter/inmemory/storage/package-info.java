/**
 * In-memory object storage adapter.
 *
 * <p>This package provides a reference implementation of the
 * {@link com.ryuqq.repoup.core.spi.ObjectStorage} SPI with per-object version tokens and
 * conditional puts, used by unit and contract tests.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No replica lag or eventual consistency simulation</li>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @see com.ryuqq.repoup.core.spi.ObjectStorage
 * @author Repoup Team
 * @since 1.0.0
 */
package com.ryuqq.repoup.adapter.inmemory.storage;
