package io.chainindex.core.storage;

import io.chainindex.core.protocol.Hash;
import io.chainindex.core.protocol.Prevout;

import java.util.List;
import java.util.Map;

/**
 * Block processing results not yet written to disk. The collections belong to the block
 * processor; a flush drains them.
 *
 * @param headers raw headers above the filesystem height
 * @param blockTxHashes concatenated tx hashes, one entry per header
 * @param undoInfos undo data for heights inside the reorg window
 * @param adds new outputs keyed by prevout
 * @param deletes database keys ({@code h} and {@code u}) of spent outputs
 */
public record FlushData(
        int height,
        long txCount,
        List<byte[]> headers,
        List<byte[]> blockTxHashes,
        List<UndoInfo> undoInfos,
        Map<Prevout, UtxoEntry> adds,
        List<byte[]> deletes,
        Hash tip
) {}
