package com.lbs.anomaly.seeder;

import com.lbs.anomaly.repository.AerospikeMetricRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

/**
 * Seeds Aerospike with synthetic daily sales facts for local testing.
 * Only runs when the "seed" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 *
 * Generates 400 days of one fact per product per day (20 products, 10 territories, 60 customers)
 * with weekly and yearly seasonality, slow growth and a few injected anomalies:
 *   - product 310: six-fold spike 10 days ago
 *   - product 345: no sales 5 days ago (zero baseline for the following day)
 *   - customer 11012: buys at twenty times the usual amount
 *   - last month of the history runs 35% above the same month a year earlier
 */
@Component
@Profile("seed")
@Order(1)
public class MetricDataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(MetricDataSeeder.class);

    static final int DAYS = 400;

    private static final String[][] PRODUCTS = {
            {"310", "Road-150 Red, 62", "Bikes"}, {"311", "Road-150 Red, 44", "Bikes"},
            {"312", "Road-150 Red, 48", "Bikes"}, {"313", "Road-150 Red, 52", "Bikes"},
            {"314", "Road-150 Red, 56", "Bikes"}, {"322", "Mountain-100 Silver, 38", "Bikes"},
            {"323", "Mountain-100 Silver, 42", "Bikes"}, {"336", "Mountain-100 Black, 38", "Bikes"},
            {"344", "Road-650 Red, 44", "Bikes"}, {"345", "Road-650 Red, 60", "Bikes"},
            {"477", "Water Bottle - 30 oz.", "Accessories"}, {"478", "Mountain Bottle Cage", "Accessories"},
            {"479", "Road Bottle Cage", "Accessories"}, {"480", "Patch Kit/8 Patches", "Accessories"},
            {"481", "Racing Socks, M", "Clothing"}, {"482", "Racing Socks, L", "Clothing"},
            {"483", "Hydration Pack - 70 oz.", "Accessories"}, {"484", "Bike Wash - Dissolver", "Accessories"},
            {"485", "Fender Set - Mountain", "Accessories"}, {"486", "All-Purpose Bike Stand", "Accessories"}
    };

    private static final String[] TERRITORIES = {
            "Northwest", "Northeast", "Central", "Southwest", "Southeast",
            "Canada", "France", "Germany", "Australia", "United Kingdom"
    };

    private final AerospikeMetricRepository repository;
    private final Clock clock;
    private final Random random = new Random(42); // fixed seed for reproducibility

    public MetricDataSeeder(AerospikeMetricRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting metric seeding ===");
        LocalDate today = LocalDate.now(clock);
        int facts = 0;

        for (int d = DAYS; d >= 1; d--) {
            LocalDate date = today.minusDays(d);
            for (String[] product : PRODUCTS) {
                double amount = dailyAmount(product, date, d);
                if (amount <= 0) continue;
                seedFact(date, product, amount);
                facts++;
            }
            if (d % 100 == 0) {
                log.info("Seeded {} facts, {} days remaining", facts, d);
            }
        }

        log.info("=== Metric seeding complete: {} facts over {} days ===", facts, DAYS);
    }

    private double dailyAmount(String[] product, LocalDate date, int daysAgo) {
        if ("345".equals(product[0]) && daysAgo == 5) return 0.0;

        double base = "Bikes".equals(product[2]) ? 2400.0 : 180.0;
        DayOfWeek dow = date.getDayOfWeek();
        double weekly = (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) ? 1.3 : 1.0;
        double yearly = 1.0 + 0.15 * Math.sin(2 * Math.PI * date.getDayOfYear() / 365.25);
        double growth = 1.0 + (DAYS - daysAgo) * 0.0005;
        double lastMonthBoost = daysAgo <= 30 ? 1.35 : 1.0;
        double noise = 1.0 + random.nextGaussian() * 0.08;

        double amount = base * weekly * yearly * growth * lastMonthBoost * noise;
        if ("310".equals(product[0]) && daysAgo == 10) amount *= 6.0;
        return Math.max(1.0, amount);
    }

    private void seedFact(LocalDate date, String[] product, double amount) {
        int territory = random.nextInt(TERRITORIES.length);
        int customer = 11000 + random.nextInt(60);
        if (customer == 11012) amount *= 20.0;
        long orders = 1 + random.nextInt("Bikes".equals(product[2]) ? 3 : 12);

        Map<String, String> attributes = new HashMap<>();
        attributes.put("ProductKey", product[0]);
        attributes.put("ProductKey" + AerospikeMetricRepository.LABEL_SUFFIX, product[1]);
        attributes.put("category", product[2]);
        attributes.put("SalesTerritoryKey", String.valueOf(territory + 1));
        attributes.put("SalesTerritoryKey" + AerospikeMetricRepository.LABEL_SUFFIX, TERRITORIES[territory]);
        attributes.put("CustomerKey", String.valueOf(customer));

        double rounded = Math.round(amount * 100.0) / 100.0;
        repository.save(date + ":" + product[0], date, attributes,
                Map.of("SalesAmount", rounded, "OrderQuantity", (double) orders), orders);
    }
}
