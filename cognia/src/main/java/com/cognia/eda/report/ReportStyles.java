package com.cognia.eda.report;

final class ReportStyles {

    private ReportStyles() {
    }

    static final String STYLESHEET = """
            <style>
                body {
                    font-family: "Segoe UI", Arial, sans-serif;
                    margin: 40px;
                    background: #f4f6f9;
                }
                h1 {
                    text-align: center;
                    color: #2c3e50;
                    margin-bottom: 30px;
                }
                h2 {
                    color: #34495e;
                    border-bottom: 2px solid #dfe6e9;
                    padding-bottom: 6px;
                    margin-bottom: 20px;
                }
                .section {
                    background: #ffffff;
                    padding: 25px;
                    border-radius: 10px;
                    box-shadow: 0 4px 12px rgba(0,0,0,0.06);
                    margin-bottom: 40px;
                }
                .info-box {
                    background: #ffffff;
                    padding: 20px;
                    border-left: 6px solid #0d6efd;
                    border-radius: 8px;
                    margin-bottom: 30px;
                    text-align: center;
                    box-shadow: 0 4px 10px rgba(0,0,0,0.06);
                }
                .table {
                    border-collapse: collapse;
                    width: 100%;
                    margin-top: 15px;
                    font-size: 14px;
                }
                .table th,
                .table td {
                    border: 1px solid #dee2e6;
                    padding: 12px;
                    text-align: center;
                    vertical-align: middle;
                }
                .table th {
                    background-color: #f1f3f5;
                    font-weight: 600;
                }
                .table tr:nth-child(even) {
                    background-color: #fafafa;
                }
                select {
                    width: 320px;
                    height: 42px;
                    padding: 6px 12px;
                    font-size: 15px;
                    border-radius: 10px;
                    border: 1px solid #ccc;
                    margin-bottom: 20px;
                }
                img {
                    display: block;
                    margin: 0 auto;
                    max-width: 100%;
                }
            </style>
            """;
}
