package com.catalogresolver.paging;

import java.util.List;

/**
 * Pages addressed by numeric offsets that are all known before the first wave.
 */
final class OffsetWaveSource<T> extends AbstractWaveSource<Integer, T> {

    private final List<Integer> offsets;
    private int position;

    OffsetWaveSource(Paginator paginator, List<Integer> offsets, PageFetcher<Integer, T> fetcher) {
        super(paginator, fetcher);
        this.offsets = List.copyOf(offsets);
    }

    @Override
    public boolean hasNextWave() {
        return !isClosed() && position < offsets.size();
    }

    @Override
    public List<List<T>> nextWave() throws InterruptedException {
        int end = position + Math.min(waveSize(), offsets.size() - position);
        List<Integer> wave = offsets.subList(position, end);
        position = end;
        return successfulItems(fetchWave(wave));
    }
}
