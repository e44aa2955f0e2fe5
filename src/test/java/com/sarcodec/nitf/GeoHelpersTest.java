package com.sarcodec.nitf;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class GeoHelpersTest {

    @Nested
    class Dms {

        @ParameterizedTest
        @CsvSource({
                "39.75, true, 394500N",
                "-33.5, true, 333000S",
                "-104.75, false, 1044500W",
                "2.0002778, false, 0020001E",
                "0.0, true, 000000N"
        })
        void shouldFormatDegreesMinutesSeconds(double degrees, boolean latitude, String expected) {
            assertThat(GeoLocation.formatDms(degrees, latitude)).isEqualTo(expected);
        }

        @Test
        void shouldFormatIgeoloInCornerOrder() {
            var igeolo = GeoLocation.formatIgeolo(new double[][]{{1, 2}, {1, 3}, {0, 3}, {0, 2}});

            assertThat(igeolo)
                    .hasSize(60)
                    .isEqualTo("010000N0020000E010000N0030000E000000N0030000E000000N0020000E");
        }

        @Test
        void shouldRejectWrongCornerCount() {
            assertThatThrownBy(() -> GeoLocation.formatIgeolo(new double[][]{{0, 0}}))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldFormatSignedDecimalPolygon() {
            assertThat(GeoLocation.formatLatLonPolygon(new double[][]{{1.5, -2.25}}))
                    .isEqualTo("+01.50000000-002.25000000");
        }
    }

    @Nested
    class Ellipsoid {

        @Test
        void shouldPlaceEquatorPrimeMeridianOnSemiMajorAxis() {
            var ecef = Wgs84.geodeticToCartesian(0, 0, 0);

            assertThat(ecef[0]).isCloseTo(Wgs84.SEMI_MAJOR_AXIS, within(1e-6));
            assertThat(ecef[1]).isCloseTo(0.0, within(1e-6));
            assertThat(ecef[2]).isCloseTo(0.0, within(1e-6));
        }

        @Test
        void shouldInvertGeodeticConversion() {
            var ecef = Wgs84.geodeticToCartesian(39.75, -104.75, 1650.0);
            var llh = Wgs84.cartesianToGeodetic(ecef);

            assertThat(llh[0]).isCloseTo(39.75, within(1e-8));
            assertThat(llh[1]).isCloseTo(-104.75, within(1e-8));
            assertThat(llh[2]).isCloseTo(1650.0, within(1e-2));
        }

        @Test
        void shouldHandlePoles() {
            var llh = Wgs84.cartesianToGeodetic(Wgs84.geodeticToCartesian(90, 0, 10));

            assertThat(llh[0]).isCloseTo(90.0, within(1e-9));
            assertThat(llh[2]).isCloseTo(10.0, within(1e-3));
        }
    }

    @Nested
    class Complexity {

        @ParameterizedTest
        @CsvSource({
                "1000, 100, 100, 3",
                "1000, 2049, 10, 5",
                "60000000, 100, 100, 5",
                "2000000000, 100, 100, 6",
                "1000, 70000, 70000, 7",
                "20000000000, 100, 100, 9"
        })
        void shouldPickLowestSatisfiedLevel(long fileLength, long rows, long cols, int level) {
            assertThat(ComplexityLevel.compute(fileLength, rows, cols)).isEqualTo(level);
        }
    }
}
