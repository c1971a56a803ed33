/*
 * どこで: Game ドメインモデル
 * 何を: 待機プレイヤーを保持する可変長リングバッファ FIFO
 * なぜ: 交代のたびに先頭取り出しと末尾追加を O(1) で行うため
 */
package com.kingtable.game.model;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * プレイヤー ID の FIFO キュー。
 *
 * <p>head/tail は常に現在の容量で剰余を取る。容量不足時は論理順にコピーして倍に拡張し、head=0 / tail=size に戻す。
 * ID の重複は検査しない（ゲーム全体での一意性は呼び出し側が保証する）。
 *
 * <p>スレッドセーフではない。GameStore のロック内でのみ操作すること。
 */
public final class WaitingQueue {

  private String[] data;
  private int head;
  private int tail;
  private int size;

  public WaitingQueue(int capacity) {
    this.data = new String[Math.max(1, capacity)];
  }

  public static WaitingQueue of(List<String> playerIds, int minCapacity) {
    final WaitingQueue queue = new WaitingQueue(Math.max(minCapacity, playerIds.size()));
    for (String playerId : playerIds) {
      queue.enqueue(playerId);
    }
    return queue;
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  @VisibleForTesting
  public int capacity() {
    return data.length;
  }

  public void enqueue(String playerId) {
    if (size == data.length) {
      grow();
    }
    data[tail] = playerId;
    tail = (tail + 1) % data.length;
    size++;
  }

  public Optional<String> dequeue() {
    if (size == 0) {
      return Optional.empty();
    }
    final String value = data[head];
    data[head] = null;
    head = (head + 1) % data.length;
    size--;
    return Optional.of(value);
  }

  public boolean contains(String playerId) {
    return indexOf(playerId) >= 0;
  }

  /**
   * 役割: 論理順で最初に一致した要素を 1 件取り除く。
   * 動作: 穴を残さず後続要素を前に詰め、残りの相対順序を保つ。一致が無ければ何もしない。
   * 前提: O(n)。キュー長はプレイヤー数で抑えられる。
   */
  public boolean removeValue(String playerId) {
    final int logicalIndex = indexOf(playerId);
    if (logicalIndex < 0) {
      return false;
    }
    for (int i = logicalIndex; i < size - 1; i++) {
      data[physical(i)] = data[physical(i + 1)];
    }
    tail = (tail - 1 + data.length) % data.length;
    data[tail] = null;
    size--;
    return true;
  }

  /** 論理順の読み取り専用コピーを返す。内部状態は変更しない。 */
  public List<String> snapshot() {
    final List<String> out = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      out.add(data[physical(i)]);
    }
    return Collections.unmodifiableList(out);
  }

  private int indexOf(String playerId) {
    for (int i = 0; i < size; i++) {
      if (data[physical(i)].equals(playerId)) {
        return i;
      }
    }
    return -1;
  }

  private int physical(int logicalIndex) {
    return (head + logicalIndex) % data.length;
  }

  private void grow() {
    final String[] grown = new String[data.length * 2];
    for (int i = 0; i < size; i++) {
      grown[i] = data[physical(i)];
    }
    data = grown;
    head = 0;
    tail = size;
  }
}
