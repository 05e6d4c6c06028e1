/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.relaybox;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.math.BigInteger;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class UtilsTest {

    @Test
    public void shouldPadLittleEndianToLength() {
        var expected = new byte[32];
        expected[0] = 1;
        assertThat(Utils.toUnsignedLittleEndian(BigInteger.ONE, 32)).isEqualTo(expected);
    }

    @Test
    public void shouldDropSignByteInLittleEndian() {
        var le = Utils.toUnsignedLittleEndian(BigInteger.ONE.shiftLeft(255), 32);
        assertThat(le).hasSize(32);
        assertThat(le[31]).isEqualTo((byte) 0x80);
    }

    @DataProvider
    public Object[][] reverseTests() {
        return new Object[][] {
                { new byte[0], new byte[0] },
                { new byte[] { 0 }, new byte[] { 0 } },
                { new byte[] { 0, 1 }, new byte[] { 1, 0 } },
                { new byte[] { 0, 1, 2 }, new byte[] { 2, 1, 0} }
        };
    }

    @Test(dataProvider = "reverseTests")
    public void shouldReverseCorrectly(byte[] original, byte[] reversed) {
        Utils.reverse(original);
        assertThat(original).isEqualTo(reversed);
    }

    @Test
    public void shouldKeepLeadingZerosInHex() {
        assertThat(Utils.hex(new byte[] { 0, 0, 1, (byte) 0xff })).isEqualTo("000001ff");
    }

    @Test
    public void shouldWipeArrays() {
        var bytes = new byte[] { 1, 2, 3 };
        var chars = new char[] { 'p', 'i', 'n' };
        Utils.wipe(bytes, null);
        Utils.wipe(chars);
        assertThat(bytes).containsOnly(0);
        assertThat(chars).containsOnly('\0');
    }

    @Test
    public void shouldRejectMissingBase64() {
        assertThatIllegalArgumentException().isThrownBy(() -> Utils.fromBase64(null));
    }

    @Test
    public void shouldRedactSecretLogArguments() {
        assertThat(RedactedLogger.redact(new byte[16])).isEqualTo("<redacted 16>");
        assertThat(RedactedLogger.redact("1234".toCharArray())).isEqualTo("<redacted 4>");
        assertThat(RedactedLogger.redact("plain")).isEqualTo("plain");
    }
}
