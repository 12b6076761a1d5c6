package cadence.store;

import cadence.player.QueueEntry;
import cadence.source.Song;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Json form of songs and queue entries, shared by the file store and player state dumps.
 */
public class QueueEntryCodec {
    private QueueEntryCodec() {}
    
    @Nonnull
    @CheckReturnValue
    public static JsonObject encodeSong(@Nonnull Song song) {
        return new JsonObject()
                .put("url", song.url())
                .put("title", song.title())
                .put("length", song.duration().toMillis())
                .put("thumbnail", song.thumbnailUrl())
                .put("requestedBy", song.requestedBy());
    }
    
    @Nonnull
    @CheckReturnValue
    public static Song decodeSong(@Nonnull JsonObject json) {
        var url = json.getString("url");
        if(url == null) {
            throw new IllegalArgumentException("Missing song url in " + json.encode());
        }
        return new Song(
                url,
                json.getString("title", ""),
                Duration.ofMillis(json.getLong("length", 0L)),
                json.getString("thumbnail"),
                json.getString("requestedBy")
        );
    }
    
    @Nonnull
    @CheckReturnValue
    public static JsonObject encode(@Nonnull QueueEntry entry) {
        return new JsonObject()
                .put("song", encodeSong(entry.song()))
                .put("textChannel", entry.textChannelId())
                .put("voiceChannel", entry.voiceChannelId());
    }
    
    @Nonnull
    @CheckReturnValue
    public static QueueEntry decode(@Nonnull JsonObject json) {
        var song = json.getJsonObject("song");
        var text = json.getString("textChannel");
        var voice = json.getString("voiceChannel");
        if(song == null || text == null || voice == null) {
            throw new IllegalArgumentException("Incomplete queue entry " + json.encode());
        }
        return new QueueEntry(decodeSong(song), text, voice);
    }
    
    @Nonnull
    @CheckReturnValue
    public static JsonArray encodeAll(@Nonnull List<QueueEntry> entries) {
        var array = new JsonArray();
        for(var e : entries) {
            array.add(encode(e));
        }
        return array;
    }
    
    @Nonnull
    @CheckReturnValue
    public static List<QueueEntry> decodeAll(@Nonnull JsonArray array) {
        var list = new ArrayList<QueueEntry>(array.size());
        for(int i = 0; i < array.size(); i++) {
            list.add(decode(array.getJsonObject(i)));
        }
        return list;
    }
}
