package io.shelfdb.storage;

import io.shelfdb.common.Direction;

interface CursorSource {

    CursorEntry first(KeyRange range, Direction direction);

    CursorEntry after(CursorEntry previous, KeyRange range, Direction direction);
}
