package com.lobsim.simulation;

import com.lobsim.domain.Fill;
import com.lobsim.matching.FillListener;
import com.lobsim.participants.MarketParticipant;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivers each fill to the participant whose name matches the fill's owner.
 * Fills for owners outside the roster (seed orders, for instance) are ignored.
 */
public class FillRouter implements FillListener {

    private final Map<String, MarketParticipant> participantsByName;

    public FillRouter(List<MarketParticipant> participants) {
        this.participantsByName = new HashMap<>();
        for (MarketParticipant participant : participants) {
            if (participantsByName.putIfAbsent(participant.getName(), participant) != null) {
                throw new IllegalArgumentException("Duplicate participant name: " + participant.getName());
            }
        }
    }

    @Override
    public void onFill(Fill fill) {
        MarketParticipant participant = participantsByName.get(fill.getOwner());
        if (participant != null) {
            participant.onFill(fill);
        }
    }
}
