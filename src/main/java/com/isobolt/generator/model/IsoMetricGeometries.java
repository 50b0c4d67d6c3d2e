package com.isobolt.generator.model;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Hand-curated base parameters of the ISO metric coarse-thread series M3 to M64.
 *
 * @see <a href="http://www.iso-gewinde.at">Thread calculator</a>
 */
final class IsoMetricGeometries {

    private IsoMetricGeometries() {
        // Utility class
    }

    static GeometryTable createTable() {
        return GeometryTable.builder()
                //            D  P     s     k     a      du1   du2  u     dh1   dh2   dh3   dgl  cls
                .boltWithThread(bolt( 3, 0.5 ,  5.5,  2  ,  1.5 ,  3.2,   7, 0.5,  3.2,  3.4,  3.6,  10,
                        3, 4, 5, 6, 8, 10, 12, 16, 18, 20, 22, 25, 30, 35, 40, 50, 60))
                .boltWithThread(bolt( 4, 0.7 ,  7  ,  2.8,  2.1 ,  4.3,   9, 0.8,  4.3,  4.5,  4.8,  20,
                        4, 6, 8, 10, 12, 14, 16, 18, 20, 22, 25, 30, 35, 40, 45, 50, 55, 60, 65, 70, 75, 80))
                .boltWithThread(bolt( 5, 0.8 ,  8  ,  3.5,  2.4 ,  5.3,  10, 1  ,  5.3,  5.5,  5.8,  50,
                        6, 8, 10, 12, 14, 16, 18, 20, 22, 25, 30, 35, 40, 45, 50, 55, 60, 65, 70, 80, 90, 100))
                .boltWithThread(bolt( 6, 1   , 10  ,  4  ,  3   ,  6.4,  12, 1.6,  6.4,  6.6,  7  ,  50,
                        6, 8, 10, 12, 14, 16, 18, 20, 22, 25, 28, 30, 35, 40, 45, 50, 55, 60, 65, 70, 75, 80, 85,
                        90, 100, 110, 120, 130, 140, 150))
                .boltWithThread(bolt( 8, 1.25, 13  ,  5.5,  3.75,  8.4,  16, 1.6,  8.4,  9  , 10  ,  50,
                        8, 10, 12, 14, 16, 18, 20, 22, 25, 30, 35, 40, 45, 50, 55, 60, 65, 70, 75, 80, 85, 90, 95,
                        100, 110, 120, 130, 140, 150, 160, 170, 180, 190, 200))
                .boltWithThread(bolt(10, 1.5 , 17  ,  6.4,  4.5 , 10.5,  20, 2  , 10.5, 11  , 12  , 100,
                        10, 12, 16, 18, 20, 22, 25, 28, 30, 35, 40, 45, 50, 55, 60, 65, 70, 75, 80, 85, 90, 100,
                        110, 120, 130, 140, 150, 160, 170, 180, 190, 200, 220, 240, 280, 300))
                .boltWithThread(bolt(12, 1.75, 19  ,  8  ,  5.5 , 13  ,  24, 2.5, 13  , 13.5, 14.5, 100,
                        10, 12, 16, 18, 20, 22, 25, 28, 30, 35, 40, 45, 50, 55, 60, 65, 70, 75, 80, 85, 90, 100,
                        110, 120, 130, 140, 150, 160, 170, 180, 190, 200, 220, 240, 300))
                .boltWithThread(bolt(14, 2   , 22  ,  9  ,  6   , 15  ,  28, 2.5, 15  , 15.5, 16.5, 100,
                        16, 20, 25, 30, 35, 40, 45, 50, 55, 60, 65, 70, 75, 80, 90, 100, 110, 120, 130, 140, 150,
                        160, 170, 180, 200, 220))
                .boltWithThread(bolt(16, 2   , 24  , 10  ,  6   , 17  ,  30, 3  , 17  , 17.5, 18.5, 150,
                        12, 16, 20, 25, 30, 35, 40, 45, 50, 55, 60, 65, 70, 75, 80, 85, 90, 95, 100, 110, 120,
                        130, 140, 150, 160, 170, 180, 190, 200, 210, 220, 230, 240, 250, 260, 280, 300, 320, 340,
                        400, 500))
                .boltWithThread(bolt(18, 2.5 , 27  , 11.5,  7.5 , 19  ,  34, 3  , 19  , 20  , 21  , 150,
                        20, 25, 30, 35, 40, 45, 50, 55, 60, 65, 70, 75, 80, 85, 90, 100, 110, 120, 130, 140, 150,
                        160, 170, 180, 190, 200))
                .boltWithThread(bolt(20, 2.5 , 30  , 12.5,  7.5 , 21  ,  37, 3  , 21  , 22  , 24  , 150,
                        20, 25, 30, 35, 40, 45, 50, 55, 60, 65, 70, 75, 80, 85, 90, 100, 110, 120, 130, 140, 150,
                        160, 170, 180, 190, 200, 210, 220, 230, 240, 250, 260, 280, 300, 360))
                .boltWithThread(bolt(22, 2.5 , 32  , 14  ,  7.5 , 23  ,  39, 3  , 23  , 24  , 26  , 150,
                        30, 35, 40, 45, 50, 55, 60, 65, 70, 75, 80, 90, 100, 110, 120, 130, 140, 150, 160, 170,
                        180, 190, 200))
                .boltWithThread(bolt(24, 3   , 36  , 15  ,  9   , 25  ,  44, 4  , 25  , 26  , 28  , 150,
                        25, 30, 35, 40, 45, 50, 55, 60, 65, 70, 75, 80, 85, 90, 100, 110, 120, 130, 140, 150, 160,
                        170, 180, 190, 200, 210, 220, 230, 240, 250, 260, 280, 300, 320, 500))
                .boltWithThread(bolt(27, 3   , 41  , 17  ,  9   , 28  ,  50, 4  , 28  , 30  , 32  , 150,
                        30, 40, 45, 50, 55, 60, 65, 70, 75, 80, 85, 90, 100, 110, 120, 130, 140, 150, 160, 170,
                        180, 190, 200, 300))
                .boltWithThread(bolt(30, 3.5 , 46  , 19  , 10.5 , 31  ,  56, 4  , 31  , 33  , 35  , 150,
                        35, 40, 45, 50, 55, 60, 65, 70, 75, 80, 85, 90, 100, 110, 120, 130, 140, 150, 160, 170,
                        180, 190, 200, 210, 220, 230, 240, 250, 260, 280, 300, 320, 340, 360, 380, 400, 500, 600))
                .boltWithThread(bolt(33, 3.5 , 50  , 21  , 10.5 , 34  ,  60, 5  , 34  , 36  , 39  , 150,
                        40, 50, 60, 65, 70, 75, 80, 90, 100, 110, 120, 130, 140, 150, 160, 170, 180, 190, 200, 300))
                .boltWithThread(bolt(36, 4   , 55  , 23  , 12   , 37  ,  66, 5  , 37  , 39  , 42  , 150,
                        40, 45, 50, 55, 60, 65, 70, 75, 80, 85, 90, 100, 110, 120, 130, 140, 150, 160, 170, 180,
                        190, 200, 220, 260, 280, 300, 320, 340, 400, 600))
                .boltWithThread(bolt(39, 4   , 60  , 25  , 12   , 40  ,  72, 6  , 40  , 43  , 45  , 150,
                        80, 90, 100, 110, 120, 130, 140, 150, 160, 180, 190, 200))
                .boltWithThread(bolt(42, 4.5 , 65  , 26  , 13.5 , 43  ,  78, 7  , 43  , 46  , 48  , 150,
                        50, 55, 60, 70, 75, 80, 85, 90, 100, 110, 120, 130, 140, 150, 160, 170, 180, 190, 200, 220,
                        250, 260, 300, 360, 400))
                .boltWithThread(bolt(45, 4.5 , 70  , 28  , 13.5 , 46  ,  85, 7  , 47  , 49  , 52  , 150,
                        90, 100, 110, 120, 130, 140, 150))
                .boltWithThread(bolt(48, 5   , 75  , 30  , 15   , 50  ,  92, 8  , 50  , 52  , 56  , 150,
                        60, 70, 80, 90, 100, 110, 120, 130, 140, 150, 160, 170, 180, 190, 200, 420))
                .boltWithThread(bolt(52, 5   , 80  , 33  , 15   , 54  ,  98, 8  , 54  , 57  , 61  , 180,
                        150, 200))
                .boltWithThread(bolt(56, 5.5 , 85  , 35  , 16.5 , 58  , 105, 9  , 58  , 62  , 66  , 180,
                        130, 140, 150, 160, 170, 190, 200, 220, 240, 250, 260, 280, 300, 380))
                .boltWithThread(bolt(64, 6   , 95  , 40  , 18   , 66  , 120, 9  , 66  , 70  , 74  , 250,
                        300))
                .build();
    }

    private static BoltGeometry bolt(int d, double p, double s, double k, double a, double du1, double du2,
                                     double u, double dh1, double dh2, double dh3, int dgl, int... cls) {
        return BoltGeometry.builder()
                .d(d).p(p).s(s).k(k).a(a)
                .du1(du1).du2(du2).u(u)
                .dh1(dh1).dh2(dh2).dh3(dh3)
                .dgl(dgl)
                .cls(Arrays.stream(cls).boxed().collect(Collectors.toList()))
                .build();
    }
}
