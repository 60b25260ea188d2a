package server;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class TuneboxApplicationTest {

    @Test
    void testPositionalPathBecomesMusicPath() {
        assertArrayEquals(
                new String[] {"--player.music-path=/home/me/Music"},
                TuneboxApplication.toSpringArgs(new String[] {"/home/me/Music"}));
    }

    @Test
    void testFlagsAreTranslated() {
        assertArrayEquals(
                new String[] {
                    "--player.shuffle=true", "--player.remote-port=9000", "--player.music-path=songs"
                },
                TuneboxApplication.toSpringArgs(new String[] {"--shuffle", "--port", "9000", "songs"}));
    }

    @Test
    void testOtherOptionsPassThrough() {
        assertArrayEquals(
                new String[] {"--player.output=null", "--port"},
                TuneboxApplication.toSpringArgs(new String[] {"--player.output=null", "--port"}));
    }

    @Test
    void testNoArguments() {
        assertEquals(0, TuneboxApplication.toSpringArgs(new String[0]).length);
    }
}
