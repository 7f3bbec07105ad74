package com.lobsim.simulation;

import com.lobsim.domain.Fill;
import com.lobsim.domain.OrderId;
import com.lobsim.domain.Side;
import com.lobsim.participants.MarketParticipant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FillRouterTest {

    @Mock
    private MarketParticipant alice;

    @Mock
    private MarketParticipant bob;

    @Test
    void routesFillToOwner() {
        when(alice.getName()).thenReturn("alice");
        when(bob.getName()).thenReturn("bob");
        FillRouter router = new FillRouter(List.of(alice, bob));
        Fill fill = fill("alice");

        router.onFill(fill);

        verify(alice).onFill(fill);
        verify(bob, never()).onFill(any());
    }

    @Test
    void ignoresUnknownOwners() {
        when(alice.getName()).thenReturn("alice");
        FillRouter router = new FillRouter(List.of(alice));

        router.onFill(fill("seed"));

        verify(alice, never()).onFill(any());
    }

    @Test
    void rejectsDuplicateNames() {
        when(alice.getName()).thenReturn("same");
        when(bob.getName()).thenReturn("same");

        assertThrows(IllegalArgumentException.class, () -> new FillRouter(List.of(alice, bob)));
    }

    private static Fill fill(String owner) {
        return new Fill(new OrderId(1), owner, Side.BUY, 100.0, 1, 0, true, 0);
    }
}
