package com.ryuqq.repoup.testkit.contract;

import com.ryuqq.repoup.core.error.MetadataBuildFailedException;
import com.ryuqq.repoup.core.model.IndexedPackage;
import com.ryuqq.repoup.core.spi.MetadataComponent;
import com.ryuqq.repoup.core.spi.MetadataGenerator;
import com.ryuqq.repoup.core.spi.MetadataRequest;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metadata generator producing a single {@code primary.txt} component that lists
 * {@code <identity> <contentHash>} per package, one per line.
 *
 * <p>Output depends only on the package set, like a real indexer, so unchanged sets yield
 * byte-identical components.</p>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public class ListingMetadataGenerator implements MetadataGenerator {

    private final AtomicInteger invocations = new AtomicInteger();
    private volatile boolean failing;

    @Override
    public List<MetadataComponent> generate(MetadataRequest request) {
        invocations.incrementAndGet();
        if (failing) {
            throw new MetadataBuildFailedException("createrepo_c: Critical: Cannot read package headers");
        }
        StringBuilder listing = new StringBuilder();
        for (IndexedPackage indexed : request.packages()) {
            // a real indexer reads every package
            request.contentSource().read(indexed);
            listing.append(indexed.descriptor().identity())
                .append(' ')
                .append(indexed.contentHash().getValue())
                .append('\n');
        }
        return List.of(new MetadataComponent("primary", "txt", listing.toString().getBytes(StandardCharsets.UTF_8)));
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public int invocations() {
        return invocations.get();
    }
}
