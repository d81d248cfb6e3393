package com.virusbot.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellStateTest {

    @Nested
    @DisplayName("Packed decoding")
    class DecodeTests {

        @Test
        @DisplayName("low bits are the owner, 0x30 bits the flag")
        void shouldSplitOwnerAndFlag() {
            CellState cell = CellState.decode(0x12);

            assertEquals(2, cell.owner());
            assertEquals(CellFlag.BASE, cell.flag());
        }

        @Test
        @DisplayName("a killed flag means neutral whatever the owner bits say")
        void killedFlagShouldDecodeAsNeutral() {
            assertTrue(CellState.decode(0x31).isNeutral());
            assertTrue(CellState.decode(0x30).isNeutral());
        }

        @Test
        @DisplayName("owner 5 means neutral")
        void ownerFiveShouldDecodeAsNeutral() {
            CellState cell = CellState.decode(5);

            assertTrue(cell.isNeutral());
            assertEquals(CellFlag.KILLED, cell.flag());
        }

        @Test
        @DisplayName("zero is an empty normal cell")
        void zeroShouldBeEmpty() {
            assertEquals(CellState.empty(), CellState.decode(0));
        }

        @Test
        @DisplayName("owner ids above 5 are rejected")
        void shouldRejectUnknownOwner() {
            assertThrows(IllegalArgumentException.class, () -> CellState.decode(0x07));
        }

        @Test
        @DisplayName("encode gives back the packed value of a player cell")
        void shouldEncodePlayerCell() {
            assertEquals(0x23, CellState.owned(3, CellFlag.FORTIFIED).encode());
            assertEquals(5, CellState.neutral().encode());
        }
    }

    @Nested
    @DisplayName("Invariants")
    class InvariantTests {

        @Test
        @DisplayName("an empty cell cannot carry a flag")
        void emptyCellMustBeNormal() {
            assertThrows(IllegalArgumentException.class, () -> new CellState(0, CellFlag.BASE));
        }

        @Test
        @DisplayName("only neutral cells are killed")
        void killedOnlyForNeutral() {
            assertThrows(IllegalArgumentException.class, () -> new CellState(2, CellFlag.KILLED));
            assertThrows(IllegalArgumentException.class, () -> new CellState(5, CellFlag.NORMAL));
        }

        @Test
        @DisplayName("player ids are 1 to 4")
        void shouldRejectInvalidPlayerId() {
            assertThrows(IllegalArgumentException.class, () -> CellState.owned(0));
            assertThrows(IllegalArgumentException.class, () -> CellState.owned(5));
        }
    }

    @Nested
    @DisplayName("Attackability")
    class AttackTests {

        @Test
        @DisplayName("normal opponent cells can be attacked")
        void normalOpponentCellIsAttackable() {
            assertTrue(CellState.owned(2).isAttackableBy(1));
        }

        @Test
        @DisplayName("base, fortified, own, empty and neutral cells cannot be attacked")
        void protectedCellsAreNotAttackable() {
            assertFalse(CellState.owned(2, CellFlag.BASE).isAttackableBy(1));
            assertFalse(CellState.owned(2, CellFlag.FORTIFIED).isAttackableBy(1));
            assertFalse(CellState.owned(1).isAttackableBy(1));
            assertFalse(CellState.empty().isAttackableBy(1));
            assertFalse(CellState.neutral().isAttackableBy(1));
        }
    }
}
