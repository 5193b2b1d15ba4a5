package com.personalrec.music;

import com.personalrec.engine.RecordFieldRegistry;
import com.personalrec.engine.RowReader;

import java.util.Map;

/**
 * One historical listening event: the song as it was played, with its engagement signals, plus context
 * that is kept for completeness but not encoded.
 */
public record ListeningRecord(
    Song song,
    double listenDurationSec,
    String device,
    String dayOfWeek,
    int recommendedBySystem,
    String recommendationSource,
    String userAction
) {
    public ListeningRecord {
        if (song == null) {
            throw new IllegalArgumentException("Listening record requires a song");
        }
        device = device == null ? "" : device;
        dayOfWeek = dayOfWeek == null ? "" : dayOfWeek;
        recommendationSource = recommendationSource == null ? "" : recommendationSource;
        userAction = userAction == null ? "" : userAction;
    }

    public static ListeningRecord of(Song song) {
        return new ListeningRecord(song, 0, "", "", 0, "", "");
    }

    public static ListeningRecord fromRow(Map<String, String> row) {
        RowReader r = new RowReader(RecordFieldRegistry.LISTENING, row);
        return new ListeningRecord(
            Song.fromRow(row),
            r.doubleOr("listenDurationSec", 0),
            r.text("device"),
            r.text("dayOfWeek"),
            r.intOr("recommendedBySystem", 0),
            r.text("recommendationSource"),
            r.text("userAction")
        );
    }

    /**
     * Identity of the song this record refers to.
     */
    public String songKey() {
        return song.key();
    }
}
