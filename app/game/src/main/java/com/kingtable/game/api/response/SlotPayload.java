package com.kingtable.game.api.response;

import com.kingtable.game.model.TeamSlot;

public record SlotPayload(String forward, String goalkeeper) {

  public static SlotPayload from(TeamSlot slot) {
    return new SlotPayload(slot.forward(), slot.goalkeeper());
  }
}
