/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * Append-only, single-writer / multiple-reader list of entries.
 *
 * <h2>Publication</h2>
 * <p>
 * The writer (who must hold the owning ledger's lock) stores the new element,
 * then publishes the (possibly regrown) array, then the new size, each through a
 * volatile write. A reader reads the size first, then the array: the array it
 * sees is at least as recent as the one the size was published with, and since
 * regrowing copies every element, every index below that size is populated.
 * So readers take snapshots without locking, and never see a partial entry
 * (entries are immutable).
 * </p>
 */
final class EntryLog {

  private final static int INIT_CAPACITY = 64;

  private volatile LedgerEntry[] array;
  private volatile int size;


  EntryLog() {
    this.array = new LedgerEntry[INIT_CAPACITY];
  }


  /**
   * Creates an instance with the given initial contents.
   */
  EntryLog(List<LedgerEntry> entries) {
    int count = entries.size();
    LedgerEntry[] init = new LedgerEntry[Math.max(INIT_CAPACITY, count + count / 2)];
    for (int index = 0; index < count; ++index)
      init[index] = Objects.requireNonNull(entries.get(index), "null entry at " + index);
    this.array = init;
    this.size = count;
  }


  int size() {
    return size;
  }


  /** Returns the last entry, or {@code null} if empty. */
  LedgerEntry last() {
    int sz = size;
    return sz == 0 ? null : array[sz - 1];
  }


  /**
   * Appends the given entry. <em>Not thread-safe: caller synchronizes writers.</em>
   */
  void add(LedgerEntry entry) {
    int sz = size;
    LedgerEntry[] arr = array;
    if (sz == arr.length) {
      arr = Arrays.copyOf(arr, arr.length * 2);
      arr[sz] = entry;
      array = arr;
    } else
      arr[sz] = entry;
    size = sz + 1;
  }


  /**
   * Returns a read-only snapshot of the entries committed so far.
   */
  List<LedgerEntry> snapshot() {
    int sz = size;
    return new Snapshot(array, sz);
  }



  private final static class Snapshot extends AbstractList<LedgerEntry> implements RandomAccess {

    private final LedgerEntry[] array;
    private final int size;

    Snapshot(LedgerEntry[] array, int size) {
      this.array = array;
      this.size = size;
    }

    @Override
    public LedgerEntry get(int index) {
      Objects.checkIndex(index, size);
      return array[index];
    }

    @Override
    public int size() {
      return size;
    }
  }

}
