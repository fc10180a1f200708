package io.codefmt.token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Ordered, mutable sequence of tokens backed by an arena of stable slots.
 *
 * <p>Each token keeps the slot it was given until it is removed; neighbours are linked by slot
 * index, so splicing a token in never moves another one. Removed slots are recycled through a
 * free list.
 */
public final class TokenList implements Iterable<Token> {

    private final List<Token> slots = new ArrayList<>();
    private final Deque<Integer> freeSlots = new ArrayDeque<>();
    private int headSlot = Token.NO_SLOT;
    private int tailSlot = Token.NO_SLOT;
    private int size;

    public Token head() {
        return at(headSlot);
    }

    public Token tail() {
        return at(tailSlot);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public Token append(Token token) {
        claim(token);
        token.prevSlot = tailSlot;
        if (tailSlot == Token.NO_SLOT) {
            headSlot = token.slot;
        } else {
            slots.get(tailSlot).nextSlot = token.slot;
        }
        tailSlot = token.slot;
        return token;
    }

    public Token insertBefore(Token anchor, Token token) {
        requireMember(anchor);
        claim(token);
        token.nextSlot = anchor.slot;
        token.prevSlot = anchor.prevSlot;
        if (anchor.prevSlot == Token.NO_SLOT) {
            headSlot = token.slot;
        } else {
            slots.get(anchor.prevSlot).nextSlot = token.slot;
        }
        anchor.prevSlot = token.slot;
        return token;
    }

    public Token insertAfter(Token anchor, Token token) {
        requireMember(anchor);
        claim(token);
        token.prevSlot = anchor.slot;
        token.nextSlot = anchor.nextSlot;
        if (anchor.nextSlot == Token.NO_SLOT) {
            tailSlot = token.slot;
        } else {
            slots.get(anchor.nextSlot).prevSlot = token.slot;
        }
        anchor.nextSlot = token.slot;
        return token;
    }

    public void remove(Token token) {
        requireMember(token);
        if (token.prevSlot == Token.NO_SLOT) {
            headSlot = token.nextSlot;
        } else {
            slots.get(token.prevSlot).nextSlot = token.nextSlot;
        }
        if (token.nextSlot == Token.NO_SLOT) {
            tailSlot = token.prevSlot;
        } else {
            slots.get(token.nextSlot).prevSlot = token.prevSlot;
        }
        slots.set(token.slot, null);
        freeSlots.push(token.slot);
        token.owner = null;
        token.slot = Token.NO_SLOT;
        token.nextSlot = Token.NO_SLOT;
        token.prevSlot = Token.NO_SLOT;
        size--;
    }

    /**
     * Adds {@code delta} to the rendered column of {@code from} and of every following token up to
     * and including the line break that ends its line.
     */
    public static void shiftLine(Token from, int delta) {
        if (delta == 0) {
            return;
        }
        for (Token token = from; token.isNotNull(); token = token.next()) {
            token.setRenderColumn(token.renderColumn() + delta);
            if (token.isNewline()) {
                break;
            }
        }
    }

    /**
     * Number of slots ever allocated, live or free.
     */
    int capacity() {
        return slots.size();
    }

    Token at(int slot) {
        if (slot == Token.NO_SLOT) {
            return Token.NULL;
        }
        Token token = slots.get(slot);
        return token == null ? Token.NULL : token;
    }

    public List<Token> toList() {
        List<Token> tokens = new ArrayList<>(size);
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Iterator<>() {
            private Token cursor = head();

            @Override
            public boolean hasNext() {
                return cursor.isNotNull();
            }

            @Override
            public Token next() {
                if (cursor.isNull()) {
                    throw new NoSuchElementException();
                }
                Token current = cursor;
                cursor = cursor.next();
                return current;
            }
        };
    }

    private void claim(Token token) {
        Objects.requireNonNull(token, "token");
        if (token.isNull()) {
            throw new IllegalArgumentException("The null token cannot be inserted");
        }
        if (token.owner != null) {
            throw new IllegalArgumentException("Token already belongs to a list: " + token);
        }
        int slot;
        if (freeSlots.isEmpty()) {
            slot = slots.size();
            slots.add(token);
        } else {
            slot = freeSlots.pop();
            slots.set(slot, token);
        }
        token.owner = this;
        token.slot = slot;
        token.nextSlot = Token.NO_SLOT;
        token.prevSlot = Token.NO_SLOT;
        size++;
    }

    private void requireMember(Token token) {
        Objects.requireNonNull(token, "token");
        if (token.owner != this) {
            throw new IllegalArgumentException("Token does not belong to this list: " + token);
        }
    }
}
