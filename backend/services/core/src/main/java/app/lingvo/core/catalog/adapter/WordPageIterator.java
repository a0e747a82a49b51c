package app.lingvo.core.catalog.adapter;

import app.lingvo.core.study.api.WordCatalogPort.CatalogWord;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.IntFunction;

/**
 * Keyset pagination over word numbers: the next page starts right after the
 * last word number of the previous one, so a page is only loaded when needed.
 */
class WordPageIterator implements Iterator<CatalogWord> {

    private final IntFunction<List<CatalogWord>> pageLoader;
    private int nextFromNumber;
    private List<CatalogWord> page = List.of();
    private int index;
    private boolean exhausted;

    WordPageIterator(int startNumber, IntFunction<List<CatalogWord>> pageLoader) {
        this.pageLoader = pageLoader;
        this.nextFromNumber = Math.max(1, startNumber);
    }

    @Override
    public boolean hasNext() {
        if (index < page.size()) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        page = pageLoader.apply(nextFromNumber);
        index = 0;
        if (page.isEmpty()) {
            exhausted = true;
            return false;
        }
        int last = page.get(page.size() - 1).wordNumber();
        if (last == Integer.MAX_VALUE) {
            exhausted = true;
        } else {
            nextFromNumber = last + 1;
        }
        return true;
    }

    @Override
    public CatalogWord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return page.get(index++);
    }
}
